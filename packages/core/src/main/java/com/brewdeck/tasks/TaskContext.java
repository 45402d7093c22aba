package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import com.brewdeck.domain.PackageType;
import com.brewdeck.exception.ExceptionUtil;
import com.brewdeck.exception.ProviderException;
import com.brewdeck.logging.LoggingService;
import com.brewdeck.provider.PackageListProvider;
import com.brewdeck.provider.PackageProvider;
import com.brewdeck.provider.ServiceProvider;
import com.brewdeck.provider.Providers;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * Handed to a singleton task while it runs on a worker thread. Gives access to the providers and
 * collects the log lines that travel back with the outcome. Confined to one worker thread.
 */
public final class TaskContext {
  private static final Logger log = LoggingService.getLogger(TaskContext.class);

  private final Providers providers;
  private final List<String> lines = new ArrayList<>();

  TaskContext(Providers providers) {
    this.providers = providers;
  }

  public PackageProvider packages() {
    return providers.packages();
  }

  public ServiceProvider services() {
    return providers.services();
  }

  public PackageListProvider packageLists() {
    return providers.packageLists();
  }

  public void info(String line) {
    log.info(line);
    lines.add(line);
  }

  public void error(String line) {
    log.error(line);
    lines.add(line);
  }

  public <P> TaskOutcome<P> succeeded(P payload, String message) {
    return new TaskOutcome<>(true, payload, message, lines);
  }

  public <P> TaskOutcome<P> failed(P payload, String message) {
    return new TaskOutcome<>(false, payload, message, lines);
  }

  /** A provider call parameterized by package category. */
  @FunctionalInterface
  public interface PerType<T> {
    T call(PackageType type) throws InterruptedException;
  }

  /**
   * Runs {@code call} once per package category and concatenates the results. A provider failure
   * for one category is logged and the other category's packages are kept.
   *
   * @param label format naming the list in log lines, {@code %s} receives "formulae" or "casks"
   */
  TaskOutcome<List<Package>> collectByType(String label, PerType<List<Package>> call)
      throws InterruptedException {
    List<Package> all = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    for (PackageType type : PackageType.values()) {
      String name = String.format(label, type == PackageType.FORMULA ? "formulae" : "casks");
      try {
        List<Package> found = List.copyOf(call.call(type));
        info("Found " + found.size() + " " + name);
        all.addAll(found);
      } catch (ProviderException e) {
        String message = "Error loading " + name + ": " + ExceptionUtil.extractErrorMessage(e);
        error(message);
        errors.add(message);
      }
    }
    if (errors.isEmpty()) {
      return succeeded(all, "Loaded " + all.size() + " packages");
    }
    return failed(all, String.join("; ", errors));
  }
}
