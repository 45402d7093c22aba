package com.brewdeck.tasks;

/** Upgrades every outdated package. */
public record UpdateAll() implements SingletonTask<Void> {
  @Override
  public TaskKind kind() {
    return TaskKind.UPDATE_ALL;
  }

  @Override
  public String describe() {
    return "updating all packages";
  }

  @Override
  public TaskOutcome<Void> run(TaskContext ctx) throws InterruptedException {
    ctx.packages().updateAll();
    ctx.info("Successfully updated all packages");
    return ctx.succeeded(null, "All packages updated successfully");
  }
}
