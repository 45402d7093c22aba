package com.brewdeck.tasks;

import com.brewdeck.exception.ExceptionUtil;
import com.brewdeck.logging.LoggingService;
import com.brewdeck.provider.Providers;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Outstanding singleton tasks, at most one per {@link TaskKind}.
 *
 * <p>Owned by the polling thread: the map is never touched by workers, which only write their
 * task's {@link ResultCell}.
 */
public final class TaskSet {
  private static final Logger log = LoggingService.getLogger(TaskSet.class);

  private final TaskExecutor executor;
  private final Providers providers;
  private final Clock clock;
  private final Map<TaskKind, Outstanding<?>> outstanding = new EnumMap<>(TaskKind.class);

  public TaskSet(TaskExecutor executor, Providers providers, Clock clock) {
    this.executor = executor;
    this.providers = providers;
    this.clock = clock;
  }

  /**
   * Start {@code task} unless one of the same kind is still outstanding.
   *
   * @return {@code false} if the submission was dropped as a duplicate
   */
  public <P> boolean submit(SingletonTask<P> task) {
    if (outstanding.containsKey(task.kind())) {
      log.warn("{} task is already running, ignoring duplicate", task.kind());
      return false;
    }
    ResultCell<TaskOutcome<P>> cell = new ResultCell<>();
    executor.spawn(() -> runTask(task, cell));
    outstanding.put(task.kind(), new Outstanding<>(task, cell, clock.instant()));
    log.debug("Started {} ({})", task.kind(), task.describe());
    return true;
  }

  /** Fold every finished task into {@code result} and forget it. Never blocks. */
  public void pollAll(TaskResult.Builder result) {
    Iterator<Outstanding<?>> it = outstanding.values().iterator();
    while (it.hasNext()) {
      if (!pollOne(it.next(), result)) {
        it.remove();
      }
    }
  }

  /**
   * Try to collect one task's outcome. Once the outcome has been taken the task is done, even if
   * merging it fails; the failure is reported as a failed completion.
   *
   * @return {@code true} to keep the task for the next poll, {@code false} once its outcome has
   *     been taken
   */
  <P> boolean pollOne(Outstanding<P> task, TaskResult.Builder result) {
    Optional<TaskOutcome<P>> outcome = task.cell.tryTake();
    if (outcome.isEmpty()) {
      return true;
    }
    TaskOutcome<P> done = outcome.get();
    try {
      task.task.merge(done, result);
    } catch (RuntimeException e) {
      String message =
          "Error collecting result of "
              + task.task.describe()
              + ": "
              + ExceptionUtil.extractErrorMessage(e);
      log.error("{} result could not be merged", task.task.kind(), e);
      result.completion(new Completion(task.task.kind(), task.task.target(), false, message));
      result.logs(List.of(message));
    }
    result.logs(done.logs());
    if (log.isDebugEnabled()) {
      log.debug(
          "{} finished (success={}) after {} ms",
          task.task.kind(),
          done.success(),
          Duration.between(task.startedAt, clock.instant()).toMillis());
    }
    return false;
  }

  public boolean isOutstanding(TaskKind kind) {
    return outstanding.containsKey(kind);
  }

  public int outstandingCount() {
    return outstanding.size();
  }

  public boolean isEmpty() {
    return outstanding.isEmpty();
  }

  /** Worker body. Publishes exactly one outcome, whatever the task does. */
  private <P> void runTask(SingletonTask<P> task, ResultCell<TaskOutcome<P>> cell) {
    TaskContext ctx = new TaskContext(providers);
    TaskOutcome<P> outcome;
    try {
      outcome = task.run(ctx);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      String message = "Interrupted while " + task.describe();
      ctx.error(message);
      outcome = ctx.failed(null, message);
    } catch (Exception e) {
      String message = "Error " + task.describe() + ": " + ExceptionUtil.extractErrorMessage(e);
      log.warn("{} failed at {}", task.kind(), ExceptionUtil.stackSummary(e, 5));
      ctx.error(message);
      outcome = ctx.failed(null, message);
    } catch (Error e) {
      String message = "Error " + task.describe() + ": " + ExceptionUtil.extractErrorMessage(e);
      ctx.error(message);
      cell.set(ctx.failed(null, message));
      throw e;
    }
    cell.set(outcome);
  }

  static final class Outstanding<P> {
    final SingletonTask<P> task;
    final ResultCell<TaskOutcome<P>> cell;
    final Instant startedAt;

    Outstanding(SingletonTask<P> task, ResultCell<TaskOutcome<P>> cell, Instant startedAt) {
      this.task = task;
      this.cell = cell;
      this.startedAt = startedAt;
    }
  }
}
