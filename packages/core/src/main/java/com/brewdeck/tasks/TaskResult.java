package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import com.brewdeck.domain.Service;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What one {@link TaskCoordinator#poll()} observed. Built fresh every frame and meant to be
 * consumed immediately; every list payload is present only in the frame its task completed.
 */
public final class TaskResult {
  private static final TaskResult EMPTY = new Builder().build();

  private final List<Package> installedPackages;
  private final List<Package> outdatedPackages;
  private final List<Package> searchResults;
  private final List<Service> services;
  private final Map<String, DetailOutcome> details;
  private final List<Completion> completions;
  private final List<String> logs;

  private TaskResult(Builder b) {
    this.installedPackages = b.installedPackages;
    this.outdatedPackages = b.outdatedPackages;
    this.searchResults = b.searchResults;
    this.services = b.services;
    this.details = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
    this.completions = List.copyOf(b.completions);
    this.logs = List.copyOf(b.logs);
  }

  public static TaskResult empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<List<Package>> installedPackages() {
    return Optional.ofNullable(installedPackages);
  }

  public Optional<List<Package>> outdatedPackages() {
    return Optional.ofNullable(outdatedPackages);
  }

  public Optional<List<Package>> searchResults() {
    return Optional.ofNullable(searchResults);
  }

  public Optional<List<Service>> services() {
    return Optional.ofNullable(services);
  }

  /** Detail lookups that finished, failed or timed out this frame, in the order observed. */
  public Map<String, DetailOutcome> details() {
    return details;
  }

  public List<String> completedDetailLoads() {
    return List.copyOf(details.keySet());
  }

  public List<Completion> completions() {
    return completions;
  }

  public Optional<Completion> completion(TaskKind kind) {
    for (Completion c : completions) {
      if (c.kind() == kind) return Optional.of(c);
    }
    return Optional.empty();
  }

  public List<String> logs() {
    return logs;
  }

  public boolean isEmpty() {
    return installedPackages == null
        && outdatedPackages == null
        && searchResults == null
        && services == null
        && details.isEmpty()
        && completions.isEmpty()
        && logs.isEmpty();
  }

  @Override
  public String toString() {
    return "TaskResult{installed="
        + size(installedPackages)
        + ", outdated="
        + size(outdatedPackages)
        + ", search="
        + size(searchResults)
        + ", services="
        + size(services)
        + ", details="
        + details.size()
        + ", completions="
        + completions.size()
        + ", logs="
        + logs.size()
        + '}';
  }

  private static String size(List<?> list) {
    return list == null ? "-" : String.valueOf(list.size());
  }

  /** Accumulates fragments from the task set and the enrichment queue during one poll. */
  public static final class Builder {
    private List<Package> installedPackages;
    private List<Package> outdatedPackages;
    private List<Package> searchResults;
    private List<Service> services;
    private final Map<String, DetailOutcome> details = new LinkedHashMap<>();
    private final List<Completion> completions = new ArrayList<>();
    private final List<String> logs = new ArrayList<>();

    private Builder() {}

    public Builder installedPackages(List<Package> packages) {
      this.installedPackages = List.copyOf(packages);
      return this;
    }

    public Builder outdatedPackages(List<Package> packages) {
      this.outdatedPackages = List.copyOf(packages);
      return this;
    }

    public Builder searchResults(List<Package> packages) {
      this.searchResults = List.copyOf(packages);
      return this;
    }

    public Builder services(List<Service> services) {
      this.services = List.copyOf(services);
      return this;
    }

    public Builder detail(String itemId, DetailOutcome outcome) {
      details.put(itemId, outcome);
      return this;
    }

    public Builder completion(Completion completion) {
      completions.add(completion);
      return this;
    }

    public Builder logs(Collection<String> lines) {
      logs.addAll(lines);
      return this;
    }

    public TaskResult build() {
      return new TaskResult(this);
    }
  }
}
