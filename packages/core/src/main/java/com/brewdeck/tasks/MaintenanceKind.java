package com.brewdeck.tasks;

/** Housekeeping operations that free disk space. */
public enum MaintenanceKind {
  CLEAN_CACHE(TaskKind.CLEAN_CACHE, "cleaning cache", "Cache cleaned successfully"),
  CLEANUP_OLD_VERSIONS(
      TaskKind.CLEANUP_OLD_VERSIONS,
      "cleaning up old versions",
      "Old versions cleaned up successfully");

  private final TaskKind taskKind;
  private final String progressive;
  private final String successMessage;

  MaintenanceKind(TaskKind taskKind, String progressive, String successMessage) {
    this.taskKind = taskKind;
    this.progressive = progressive;
    this.successMessage = successMessage;
  }

  public TaskKind taskKind() {
    return taskKind;
  }

  String progressive() {
    return progressive;
  }

  String successMessage() {
    return successMessage;
  }
}
