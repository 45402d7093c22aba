package com.brewdeck.tasks;

import java.util.Objects;

/** Starts, stops or restarts one service. */
public record ServiceAction(ServiceActionKind action, String serviceName)
    implements SingletonTask<Void> {
  public ServiceAction {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(serviceName, "serviceName");
  }

  @Override
  public TaskKind kind() {
    return action.taskKind();
  }

  @Override
  public String describe() {
    return action.progressive() + " service " + serviceName;
  }

  @Override
  public String target() {
    return serviceName;
  }

  @Override
  public TaskOutcome<Void> run(TaskContext ctx) throws InterruptedException {
    switch (action) {
      case START -> ctx.services().start(serviceName);
      case STOP -> ctx.services().stop(serviceName);
      case RESTART -> ctx.services().restart(serviceName);
    }
    String message = "Successfully " + action.past() + " service " + serviceName;
    ctx.info(message);
    return ctx.succeeded(null, message);
  }
}
