package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import java.util.List;

/** Loads formulae and casks that have a newer version available. */
public record LoadOutdated() implements SingletonTask<List<Package>> {
  @Override
  public TaskKind kind() {
    return TaskKind.LOAD_OUTDATED;
  }

  @Override
  public String describe() {
    return "loading outdated packages";
  }

  @Override
  public TaskOutcome<List<Package>> run(TaskContext ctx) throws InterruptedException {
    return ctx.collectByType("outdated %s", type -> ctx.packages().outdatedPackages(type));
  }

  @Override
  public void merge(TaskOutcome<List<Package>> outcome, TaskResult.Builder result) {
    result.outdatedPackages(outcome.payload() == null ? List.of() : outcome.payload());
  }
}
