package com.brewdeck.tasks;

import com.brewdeck.domain.CleanupPreview;
import com.brewdeck.domain.PackageType;
import com.brewdeck.logging.LoggingService;
import com.brewdeck.provider.Providers;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Bridges the single-threaded render loop with background work.
 *
 * <p>The render loop calls {@link #submit(Task)} in response to user actions and {@link #poll()}
 * once per frame. Neither call waits for background work. All methods must be called from the
 * same thread; workers never touch the coordinator's state.
 *
 * <p>Within one poll, singleton results are collected before detail lookups. No completion order
 * is promised across different singleton kinds or across detail items; only admission of queued
 * detail lookups is FIFO.
 */
public final class TaskCoordinator {
  private static final Logger log = LoggingService.getLogger(TaskCoordinator.class);

  private final Providers providers;
  private final TaskExecutor executor;
  private final TaskSet taskSet;
  private final EnrichmentQueue enrichment;

  public TaskCoordinator(Providers providers, TaskExecutor executor, TaskSettings settings) {
    this(providers, executor, settings, Clock.systemUTC());
  }

  public TaskCoordinator(
      Providers providers, TaskExecutor executor, TaskSettings settings, Clock clock) {
    this.providers = providers;
    this.executor = executor;
    this.taskSet = new TaskSet(executor, providers, clock);
    EnrichmentQueue.DetailLoader loader =
        (name, type) -> providers.packages().packageInfo(name, type);
    this.enrichment = new EnrichmentQueue(executor, loader, settings, clock);
  }

  /**
   * Fire-and-forget submission. Singletons are dropped while one of the same kind is outstanding;
   * detail requests are merged with an in-flight or queued request for the same item.
   *
   * @return {@code true} if the task was started or queued
   */
  public boolean submit(Task task) {
    if (task instanceof SingletonTask<?> singleton) {
      return taskSet.submit(singleton);
    }
    if (task instanceof LoadItemDetail detail) {
      return enrichment.request(detail.itemId(), detail.category());
    }
    throw new IllegalArgumentException("Unsupported task: " + task);
  }

  public boolean requestDetail(String itemId, PackageType category) {
    return submit(new LoadItemDetail(itemId, category));
  }

  /**
   * Collect everything that finished since the last frame and refill free detail lookup slots.
   * Never blocks and never reports task failures as exceptions; an idle coordinator returns {@link
   * TaskResult#empty()}.
   */
  public TaskResult poll() {
    if (!hasOutstandingWork()) {
      return TaskResult.empty();
    }
    TaskResult.Builder result = TaskResult.builder();
    taskSet.pollAll(result);

    Map<String, DetailOutcome> details = enrichment.pollAll();
    details.forEach(result::detail);
    enrichment.replenish();

    TaskResult built = result.build();
    if (!built.isEmpty()) {
      log.trace("Poll produced {}", built);
    }
    return built;
  }

  /**
   * Ask the provider what a maintenance operation would remove. Blocks the caller; intended for a
   * confirmation dialog opened by a user action.
   */
  public CleanupPreview previewCleanup(MaintenanceKind kind) {
    return executor.runBlocking(
        () ->
            kind == MaintenanceKind.CLEAN_CACHE
                ? providers.packages().cleanCachePreview()
                : providers.packages().cleanupOldVersionsPreview());
  }

  public boolean isRunning(TaskKind kind) {
    return taskSet.isOutstanding(kind);
  }

  public boolean isEnrichmentInFlight(String itemId) {
    return enrichment.isInFlight(itemId);
  }

  public boolean isEnrichmentPending(String itemId) {
    return enrichment.isPending(itemId);
  }

  public int pendingEnrichmentCount() {
    return enrichment.pendingCount();
  }

  public int inFlightEnrichmentCount() {
    return enrichment.inFlightCount();
  }

  public boolean canAdmitMoreEnrichment() {
    return enrichment.canAdmitMore();
  }

  public boolean hasOutstandingWork() {
    return !taskSet.isEmpty() || !enrichment.isIdle();
  }
}
