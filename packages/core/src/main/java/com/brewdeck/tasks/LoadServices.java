package com.brewdeck.tasks;

import com.brewdeck.domain.Service;
import java.util.List;

public record LoadServices() implements SingletonTask<List<Service>> {
  @Override
  public TaskKind kind() {
    return TaskKind.LOAD_SERVICES;
  }

  @Override
  public String describe() {
    return "loading services";
  }

  @Override
  public TaskOutcome<List<Service>> run(TaskContext ctx) throws InterruptedException {
    List<Service> services = List.copyOf(ctx.services().listServices());
    String message = "Loaded " + services.size() + " services";
    ctx.info(message);
    return ctx.succeeded(services, message);
  }

  @Override
  public void merge(TaskOutcome<List<Service>> outcome, TaskResult.Builder result) {
    result.services(outcome.payload() == null ? List.of() : outcome.payload());
  }
}
