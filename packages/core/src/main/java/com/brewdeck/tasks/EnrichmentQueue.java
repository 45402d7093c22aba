package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import com.brewdeck.domain.PackageType;
import com.brewdeck.exception.ExceptionUtil;
import com.brewdeck.logging.LoggingService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Future;
import org.slf4j.Logger;

/**
 * Bounded, deduplicated queue of per-package detail lookups.
 *
 * <p>At most {@code maxConcurrent} lookups are in flight; further requests wait in a FIFO queue and
 * are admitted in request order as slots free up. An item id is either in flight, pending, or
 * unknown, never two of these at once. A lookup that has not answered within {@code timeout} is
 * reported as {@link DetailOutcome.TimedOut} and dropped from tracking; what happens to its worker
 * is decided by the configured {@link TimeoutPolicy}.
 *
 * <p>All state is confined to the polling thread.
 */
public final class EnrichmentQueue {
  private static final Logger log = LoggingService.getLogger(EnrichmentQueue.class);

  /** Blocking detail lookup executed on a worker thread. */
  @FunctionalInterface
  public interface DetailLoader {
    Package load(String itemId, PackageType category) throws InterruptedException;
  }

  /** A request waiting for a free slot. */
  public record PendingLoad(String itemId, PackageType category) {}

  private final TaskExecutor executor;
  private final DetailLoader loader;
  private final Clock clock;
  private final int maxConcurrent;
  private final Duration timeout;
  private final TimeoutPolicy timeoutPolicy;

  private final Map<String, InFlightLoad> inFlight = new LinkedHashMap<>();
  private final Deque<PendingLoad> pending = new ArrayDeque<>();
  private final Set<String> pendingIds = new HashSet<>();

  public EnrichmentQueue(
      TaskExecutor executor, DetailLoader loader, TaskSettings settings, Clock clock) {
    this.executor = executor;
    this.loader = loader;
    this.clock = clock;
    this.maxConcurrent = settings.maxConcurrentEnrichment();
    this.timeout = settings.enrichmentTimeout();
    this.timeoutPolicy = settings.timeoutPolicy();
  }

  /**
   * Ask for {@code itemId}'s details. Launches at once when a slot is free, otherwise queues.
   *
   * @return {@code false} if the item was already in flight or queued and the request was merged
   */
  public boolean request(String itemId, PackageType category) {
    if (inFlight.containsKey(itemId)) {
      log.debug("Already loading info for {}, skipping", itemId);
      return false;
    }
    if (pendingIds.contains(itemId)) {
      log.debug("Already queued for loading: {}", itemId);
      return false;
    }
    if (canAdmitMore()) {
      launchNow(itemId, category);
    } else {
      pending.addLast(new PendingLoad(itemId, category));
      pendingIds.add(itemId);
    }
    return true;
  }

  /**
   * Start the lookup immediately. A pending entry for the same id is removed first so the id never
   * sits in both places.
   *
   * @throws IllegalStateException if no slot is free
   */
  public void launchNow(String itemId, PackageType category) {
    if (inFlight.containsKey(itemId)) {
      log.debug("Already loading info for {}, skipping", itemId);
      return;
    }
    if (!canAdmitMore()) {
      throw new IllegalStateException(
          "Cannot launch " + itemId + ": " + maxConcurrent + " lookups already in flight");
    }
    if (pendingIds.remove(itemId)) {
      pending.removeIf(p -> p.itemId().equals(itemId));
    }
    log.info("Starting to load package info for {} ({})", itemId, category);

    ResultCell<DetailOutcome> cell = new ResultCell<>();
    Future<?> work = executor.spawn(() -> lookup(itemId, category, cell));
    inFlight.put(itemId, new InFlightLoad(itemId, category, clock.instant(), cell, work));
  }

  public boolean canAdmitMore() {
    return inFlight.size() < maxConcurrent;
  }

  /** Remove up to {@code n} requests from the head of the pending queue, oldest first. */
  public List<PendingLoad> drainPending(int n) {
    int count = Math.min(Math.max(n, 0), pending.size());
    List<PendingLoad> drained = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      PendingLoad next = pending.pollFirst();
      pendingIds.remove(next.itemId());
      drained.add(next);
    }
    return drained;
  }

  /**
   * Collect every lookup that answered or expired since the last call. Never blocks: a cell whose
   * guard is held by its writer is simply checked again next time.
   */
  public Map<String, DetailOutcome> pollAll() {
    if (inFlight.isEmpty()) {
      return Map.of();
    }
    Map<String, DetailOutcome> finished = new LinkedHashMap<>();
    Instant now = clock.instant();
    Iterator<InFlightLoad> it = inFlight.values().iterator();
    while (it.hasNext()) {
      InFlightLoad load = it.next();
      Duration elapsed = Duration.between(load.startedAt, now);
      if (elapsed.compareTo(timeout) > 0) {
        log.warn(
            "Package info loading timed out for {} after {} ms", load.itemId, elapsed.toMillis());
        timeoutPolicy.onTimeout(load.work);
        finished.put(load.itemId, new DetailOutcome.TimedOut(load.itemId, load.category, elapsed));
        it.remove();
        continue;
      }
      load.cell
          .tryTake()
          .ifPresent(
              outcome -> {
                finished.put(load.itemId, outcome);
                it.remove();
              });
    }
    return finished;
  }

  /**
   * Top the in-flight set back up toward {@code maxConcurrent} from the pending queue.
   *
   * @return number of lookups launched
   */
  public int replenish() {
    if (pending.isEmpty() || !canAdmitMore()) {
      return 0;
    }
    List<PendingLoad> batch = drainPending(maxConcurrent - inFlight.size());
    for (PendingLoad load : batch) {
      launchNow(load.itemId(), load.category());
    }
    log.info(
        "Started batch load of {} packages ({} remaining in queue)", batch.size(), pending.size());
    return batch.size();
  }

  public boolean isInFlight(String itemId) {
    return inFlight.containsKey(itemId);
  }

  public boolean isPending(String itemId) {
    return pendingIds.contains(itemId);
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  public int pendingCount() {
    return pending.size();
  }

  public boolean isIdle() {
    return inFlight.isEmpty() && pending.isEmpty();
  }

  private void lookup(String itemId, PackageType category, ResultCell<DetailOutcome> cell) {
    DetailOutcome outcome;
    try {
      Package detail = loader.load(itemId, category);
      if (detail == null) {
        outcome = new DetailOutcome.Failed(itemId, category, "No details returned for " + itemId);
      } else {
        log.info(
            "Successfully loaded package info for {}: version={}", itemId, detail.version());
        outcome = new DetailOutcome.Loaded(itemId, detail);
      }
    } catch (InterruptedException e) {
      // timed out under TimeoutPolicy.INTERRUPT, or forced shutdown; nobody reads the cell
      Thread.currentThread().interrupt();
      log.debug("Package info lookup for {} interrupted", itemId);
      return;
    } catch (Exception e) {
      String message = ExceptionUtil.extractErrorMessage(e);
      log.error("Error loading package info for {}: {}", itemId, message);
      outcome = new DetailOutcome.Failed(itemId, category, message);
    } catch (Error e) {
      String message = ExceptionUtil.extractErrorMessage(e);
      log.error("Error loading package info for {}: {}", itemId, message);
      cell.set(new DetailOutcome.Failed(itemId, category, message));
      throw e;
    }
    cell.set(outcome);
  }

  private static final class InFlightLoad {
    final String itemId;
    final PackageType category;
    final Instant startedAt;
    final ResultCell<DetailOutcome> cell;
    final Future<?> work;

    InFlightLoad(
        String itemId,
        PackageType category,
        Instant startedAt,
        ResultCell<DetailOutcome> cell,
        Future<?> work) {
      this.itemId = itemId;
      this.category = category;
      this.startedAt = startedAt;
      this.cell = cell;
      this.work = work;
    }
  }
}
