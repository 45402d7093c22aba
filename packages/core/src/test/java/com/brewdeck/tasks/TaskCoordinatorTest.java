package com.brewdeck.tasks;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.brewdeck.domain.CleanupItem;
import com.brewdeck.domain.CleanupPreview;
import com.brewdeck.domain.Package;
import com.brewdeck.domain.PackageType;
import com.brewdeck.exception.ProviderException;
import com.brewdeck.provider.PackageListProvider;
import com.brewdeck.provider.PackageProvider;
import com.brewdeck.provider.Providers;
import com.brewdeck.provider.ServiceProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskCoordinatorTest {

  PackageProvider packages;
  ServiceProvider services;
  PackageListProvider packageLists;
  TaskExecutor executor;
  TaskCoordinator coordinator;
  MutableClock clock;

  final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
  final CountDownLatch release = new CountDownLatch(1);

  @BeforeEach
  void setup() throws Exception {
    packages = mock(PackageProvider.class);
    services = mock(ServiceProvider.class);
    packageLists = mock(PackageListProvider.class);
    when(packages.packageInfo(anyString(), any()))
        .thenAnswer(
            inv -> {
              String name = inv.getArgument(0);
              gate(name).await(10, TimeUnit.SECONDS);
              return Package.of(name, inv.getArgument(1)).withVersion("2.0");
            });

    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    TaskSettings settings = TaskSettings.defaults();
    executor = new TaskExecutor(settings);
    coordinator =
        new TaskCoordinator(
            new Providers(packages, services, packageLists), executor, settings, clock);
  }

  @AfterEach
  void tearDown() {
    release.countDown();
    gates.values().forEach(CountDownLatch::countDown);
    executor.shutdown();
  }

  private CountDownLatch gate(String name) {
    return gates.computeIfAbsent(name, k -> new CountDownLatch(1));
  }

  @Test
  @DisplayName("An idle coordinator returns the empty result without touching providers")
  void idlePollIsEmpty() {
    assertFalse(coordinator.hasOutstandingWork());
    TaskResult result = coordinator.poll();

    assertSame(TaskResult.empty(), result);
    assertTrue(result.isEmpty());
    verifyNoInteractions(packages, services, packageLists);
  }

  @Test
  @DisplayName("Two installed-package loads in a row produce exactly one installed list")
  void singletonSubmittedTwiceYieldsOneResult() throws Exception {
    when(packages.installedPackages(any()))
        .thenAnswer(
            inv -> {
              release.await(5, TimeUnit.SECONDS);
              return List.of(Package.of("wget", PackageType.FORMULA));
            });

    assertTrue(coordinator.submit(new LoadInstalled()));
    assertFalse(coordinator.submit(new LoadInstalled()));
    assertTrue(coordinator.isRunning(TaskKind.LOAD_INSTALLED));

    release.countDown();
    List<TaskResult> frames = pollUntil(r -> r.installedPackages().isPresent());
    for (int i = 0; i < 5; i++) {
      frames.add(coordinator.poll());
    }

    long events = frames.stream().filter(r -> r.installedPackages().isPresent()).count();
    assertEquals(1, events);
    assertFalse(coordinator.isRunning(TaskKind.LOAD_INSTALLED));
    verify(packages, times(1)).installedPackages(PackageType.FORMULA);
  }

  @Test
  @DisplayName("Twenty detail requests fill the fifteen slots and refill them as lookups finish")
  void detailRequestsAreBoundedAndRefilled() throws Exception {
    for (int i = 1; i <= 20; i++) {
      coordinator.requestDetail("pkg-" + i, PackageType.FORMULA);
    }
    assertEquals(15, coordinator.inFlightEnrichmentCount());
    assertEquals(5, coordinator.pendingEnrichmentCount());
    assertFalse(coordinator.canAdmitMoreEnrichment());
    assertTrue(coordinator.isEnrichmentInFlight("pkg-1"));
    assertTrue(coordinator.isEnrichmentPending("pkg-16"));

    for (int i = 1; i <= 3; i++) {
      gate("pkg-" + i).countDown();
    }
    List<TaskResult> frames = pollUntil(r -> false, 3);
    List<String> done = new ArrayList<>();
    frames.forEach(r -> done.addAll(r.completedDetailLoads()));

    assertEquals(List.of("pkg-1", "pkg-2", "pkg-3"), done.stream().sorted().toList());
    assertEquals(15, coordinator.inFlightEnrichmentCount());
    assertEquals(2, coordinator.pendingEnrichmentCount());
    assertTrue(coordinator.isEnrichmentInFlight("pkg-16"));
    assertTrue(coordinator.isEnrichmentInFlight("pkg-18"));
    assertTrue(coordinator.isEnrichmentPending("pkg-19"));
    frames.stream()
        .flatMap(r -> r.details().values().stream())
        .forEach(d -> assertEquals("2.0", d.asPackage().version()));
  }

  @Test
  @DisplayName("A detail lookup that never answers is reported once as a version load failure")
  void timedOutDetailIsReported() {
    coordinator.requestDetail("stuck", PackageType.CASK);
    clock.advance(Duration.ofSeconds(10).plusMillis(1));

    TaskResult result = coordinator.poll();
    DetailOutcome outcome = result.details().get("stuck");
    assertInstanceOf(DetailOutcome.TimedOut.class, outcome);
    assertTrue(outcome.asPackage().versionLoadFailed());
    assertFalse(coordinator.hasOutstandingWork());
    assertSame(TaskResult.empty(), coordinator.poll());
  }

  @Test
  @DisplayName("poll returns promptly while many tasks are blocked in providers")
  void pollNeverBlocks() throws Exception {
    when(packages.outdatedPackages(any()))
        .thenAnswer(
            inv -> {
              release.await(5, TimeUnit.SECONDS);
              return List.of();
            });
    doAnswer(inv -> release.await(5, TimeUnit.SECONDS)).when(packages).updateAll();
    doAnswer(inv -> release.await(5, TimeUnit.SECONDS)).when(packages).cleanCache();
    when(services.listServices())
        .thenAnswer(
            inv -> {
              release.await(5, TimeUnit.SECONDS);
              return List.of();
            });

    coordinator.submit(new LoadOutdated());
    coordinator.submit(new UpdateAll());
    coordinator.submit(new Maintenance(MaintenanceKind.CLEAN_CACHE));
    coordinator.submit(new LoadServices());
    for (int i = 0; i < 30; i++) {
      coordinator.requestDetail("slow-" + i, PackageType.FORMULA);
    }

    for (int i = 0; i < 20; i++) {
      TaskResult frame = assertTimeout(Duration.ofMillis(200), () -> coordinator.poll());
      assertTrue(frame.isEmpty());
    }
    assertTrue(coordinator.isRunning(TaskKind.UPDATE_ALL));
    assertEquals(15, coordinator.inFlightEnrichmentCount());
  }

  @Test
  @DisplayName("Maintenance completion carries its fixed success message")
  void maintenanceCompletion() throws Exception {
    coordinator.submit(new Maintenance(MaintenanceKind.CLEANUP_OLD_VERSIONS));
    TaskResult result =
        pollUntil(r -> r.completion(TaskKind.CLEANUP_OLD_VERSIONS).isPresent()).get(0);

    Completion completion = result.completion(TaskKind.CLEANUP_OLD_VERSIONS).get();
    assertTrue(completion.success());
    assertEquals("Old versions cleaned up successfully", completion.message());
    verify(packages).cleanupOldVersions();
  }

  @Test
  void previewCleanupReturnsProviderAnswer() throws Exception {
    CleanupPreview preview =
        CleanupPreview.of(
            List.of(
                new CleanupItem("/cache/wget--1.21.tar.gz", 1_000),
                new CleanupItem("/cache/jq--1.7.bottle", 500)));
    when(packages.cleanCachePreview()).thenReturn(preview);

    CleanupPreview result = coordinator.previewCleanup(MaintenanceKind.CLEAN_CACHE);

    assertEquals(1_500, result.totalSize());
    assertEquals(2, result.items().size());
    verify(packages, never()).cleanupOldVersionsPreview();
  }

  @Test
  void previewCleanupPropagatesProviderError() throws Exception {
    when(packages.cleanupOldVersionsPreview())
        .thenThrow(new ProviderException("brew cleanup --dry-run failed"));

    ProviderException e =
        assertThrows(
            ProviderException.class,
            () -> coordinator.previewCleanup(MaintenanceKind.CLEANUP_OLD_VERSIONS));
    assertEquals("brew cleanup --dry-run failed", e.getMessage());
  }

  @Test
  void submitRoutesDetailRequests() {
    assertTrue(coordinator.submit(new LoadItemDetail("jq", PackageType.FORMULA)));
    assertFalse(coordinator.submit(new LoadItemDetail("jq", PackageType.FORMULA)));
    assertTrue(coordinator.isEnrichmentInFlight("jq"));
    assertTrue(coordinator.hasOutstandingWork());
  }

  private List<TaskResult> pollUntil(Predicate<TaskResult> done) throws Exception {
    return pollUntil(done, Integer.MAX_VALUE);
  }

  /**
   * Poll until a frame satisfies {@code done} or {@code detailCount} detail outcomes have been
   * seen. Returns the non-empty frames, the matching one first when {@code done} fires.
   */
  private List<TaskResult> pollUntil(Predicate<TaskResult> done, int detailCount)
      throws Exception {
    List<TaskResult> frames = new ArrayList<>();
    int details = 0;
    long end = System.currentTimeMillis() + 5_000;
    while (System.currentTimeMillis() < end) {
      TaskResult result = coordinator.poll();
      if (done.test(result)) {
        frames.add(0, result);
        return frames;
      }
      if (!result.isEmpty()) frames.add(result);
      details += result.details().size();
      if (details >= detailCount) return frames;
      Thread.sleep(10);
    }
    fail("Timeout waiting for coordinator result");
    return null; // Unreachable
  }
}
