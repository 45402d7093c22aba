package com.brewdeck.tasks;

/** Operations that change a single package. */
public enum MutationKind {
  INSTALL(TaskKind.INSTALL, "installing", "installed"),
  UNINSTALL(TaskKind.UNINSTALL, "uninstalling", "uninstalled"),
  UPDATE(TaskKind.UPDATE, "updating", "updated"),
  PIN(TaskKind.PIN, "pinning", "pinned"),
  UNPIN(TaskKind.UNPIN, "unpinning", "unpinned");

  private final TaskKind taskKind;
  private final String progressive;
  private final String past;

  MutationKind(TaskKind taskKind, String progressive, String past) {
    this.taskKind = taskKind;
    this.progressive = progressive;
    this.past = past;
  }

  public TaskKind taskKind() {
    return taskKind;
  }

  String progressive() {
    return progressive;
  }

  String past() {
    return past;
  }
}
