package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import java.util.List;
import java.util.Objects;

/** Searches formulae and casks by name. A later search is dropped while one is running. */
public record Search(String query) implements SingletonTask<List<Package>> {
  public Search {
    Objects.requireNonNull(query, "query");
  }

  @Override
  public TaskKind kind() {
    return TaskKind.SEARCH;
  }

  @Override
  public String describe() {
    return "searching for '" + query + "'";
  }

  @Override
  public TaskOutcome<List<Package>> run(TaskContext ctx) throws InterruptedException {
    return ctx.collectByType(
        "%s matching '" + query.replace("%", "%%") + "'",
        type -> ctx.packages().search(query, type));
  }

  @Override
  public void merge(TaskOutcome<List<Package>> outcome, TaskResult.Builder result) {
    result.searchResults(outcome.payload() == null ? List.of() : outcome.payload());
  }
}
