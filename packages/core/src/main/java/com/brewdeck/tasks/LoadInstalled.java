package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import java.util.List;

/** Loads installed formulae and casks. */
public record LoadInstalled() implements SingletonTask<List<Package>> {
  @Override
  public TaskKind kind() {
    return TaskKind.LOAD_INSTALLED;
  }

  @Override
  public String describe() {
    return "loading installed packages";
  }

  @Override
  public TaskOutcome<List<Package>> run(TaskContext ctx) throws InterruptedException {
    return ctx.collectByType("installed %s", type -> ctx.packages().installedPackages(type));
  }

  @Override
  public void merge(TaskOutcome<List<Package>> outcome, TaskResult.Builder result) {
    result.installedPackages(outcome.payload() == null ? List.of() : outcome.payload());
  }
}
