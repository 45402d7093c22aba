package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import java.util.Objects;

/** Installs, uninstalls, updates, pins or unpins one package. */
public record MutatePackage(MutationKind mutation, Package pkg) implements SingletonTask<Void> {
  public MutatePackage {
    Objects.requireNonNull(mutation, "mutation");
    Objects.requireNonNull(pkg, "pkg");
  }

  @Override
  public TaskKind kind() {
    return mutation.taskKind();
  }

  @Override
  public String describe() {
    return mutation.progressive() + " " + pkg.name();
  }

  @Override
  public String target() {
    return pkg.name();
  }

  @Override
  public TaskOutcome<Void> run(TaskContext ctx) throws InterruptedException {
    switch (mutation) {
      case INSTALL -> ctx.packages().install(pkg);
      case UNINSTALL -> ctx.packages().uninstall(pkg);
      case UPDATE -> ctx.packages().update(pkg);
      case PIN -> ctx.packages().pin(pkg);
      case UNPIN -> ctx.packages().unpin(pkg);
    }
    String message = "Successfully " + mutation.past() + " " + pkg.name();
    ctx.info(message);
    return ctx.succeeded(null, message);
  }
}
