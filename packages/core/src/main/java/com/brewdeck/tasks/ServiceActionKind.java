package com.brewdeck.tasks;

public enum ServiceActionKind {
  START(TaskKind.START_SERVICE, "starting", "started"),
  STOP(TaskKind.STOP_SERVICE, "stopping", "stopped"),
  RESTART(TaskKind.RESTART_SERVICE, "restarting", "restarted");

  private final TaskKind taskKind;
  private final String progressive;
  private final String past;

  ServiceActionKind(TaskKind taskKind, String progressive, String past) {
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
