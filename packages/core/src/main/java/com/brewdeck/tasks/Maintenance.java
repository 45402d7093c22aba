package com.brewdeck.tasks;

import java.util.Objects;

public record Maintenance(MaintenanceKind maintenance) implements SingletonTask<Void> {
  public Maintenance {
    Objects.requireNonNull(maintenance, "maintenance");
  }

  @Override
  public TaskKind kind() {
    return maintenance.taskKind();
  }

  @Override
  public String describe() {
    return maintenance.progressive();
  }

  @Override
  public TaskOutcome<Void> run(TaskContext ctx) throws InterruptedException {
    if (maintenance == MaintenanceKind.CLEAN_CACHE) {
      ctx.packages().cleanCache();
    } else {
      ctx.packages().cleanupOldVersions();
    }
    ctx.info(maintenance.successMessage());
    return ctx.succeeded(null, maintenance.successMessage());
  }
}
