package com.brewdeck.tasks;

import com.brewdeck.exception.BrewDeckException;
import com.brewdeck.exception.ExceptionUtil;
import com.brewdeck.exception.ExecutorException;
import com.brewdeck.exception.ProviderException;
import com.brewdeck.logging.LoggingService;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Background runtime shared by every task. Workers are daemon threads from a cached pool, so each
 * unit of work may block on provider I/O without starving the others.
 */
public final class TaskExecutor implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(TaskExecutor.class);

  private final ExecutorService executor;
  private final long shutdownTimeoutSeconds;
  private final AtomicBoolean shutDown = new AtomicBoolean(false);

  public TaskExecutor(TaskSettings settings) {
    this(
        Executors.newCachedThreadPool(workerThreads(settings.threadNamePrefix())),
        settings.shutdownTimeoutSeconds());
  }

  TaskExecutor(ExecutorService executor, long shutdownTimeoutSeconds) {
    this.executor = executor;
    this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
  }

  /**
   * Schedule {@code work} and return immediately. The work is responsible for publishing its own
   * result; the returned handle is only used to interrupt it. Anything {@code work} throws is
   * logged here, since nobody reads the handle.
   *
   * @throws ExecutorException if the runtime refuses the work
   */
  public Future<?> spawn(Runnable work) {
    Runnable logged =
        () -> {
          try {
            work.run();
          } catch (RuntimeException | Error e) {
            log.error("Background work failed on {}", Thread.currentThread().getName(), e);
            throw e;
          }
        };
    try {
      return executor.submit(logged);
    } catch (RejectedExecutionException e) {
      log.error("Background runtime rejected work; executor shut down or exhausted", e);
      throw new ExecutorException("Background runtime cannot accept work", e);
    }
  }

  /**
   * Run {@code work} on the runtime and wait for it. Reserved for short, user-initiated calls whose
   * answer is needed before the next step (e.g. a cleanup preview); never call it from the
   * per-frame poll path.
   *
   * @throws ProviderException wrapping any failure of {@code work} that is not already a {@link
   *     BrewDeckException}
   * @throws ExecutorException if the runtime refuses the work or the wait is interrupted
   */
  public <T> T runBlocking(Callable<T> work) {
    Future<T> future;
    try {
      future = executor.submit(work);
    } catch (RejectedExecutionException e) {
      log.error("Background runtime rejected blocking work", e);
      throw new ExecutorException("Background runtime cannot accept work", e);
    }
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ExecutorException("Interrupted while waiting for background work", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof BrewDeckException bde) {
        throw bde;
      }
      throw new ProviderException(ExceptionUtil.extractErrorMessage(cause), cause);
    }
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }

  /** Stop accepting work, wait for running work, then interrupt what is left. Idempotent. */
  public void shutdown() {
    if (!shutDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down background runtime...");
    executor.shutdown();
    try {
      if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
        List<Runnable> dropped = executor.shutdownNow();
        log.warn(
            "Background runtime did not terminate in {} seconds; {} queued tasks dropped",
            shutdownTimeoutSeconds,
            dropped.size());
        if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
          log.error("Background runtime did not terminate even after forceful shutdown");
        }
      } else {
        log.info("Background runtime terminated gracefully");
      }
    } catch (InterruptedException ie) {
      log.warn("Background runtime shutdown interrupted. Forcing shutdown now.");
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  private static ThreadFactory workerThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
