package com.brewdeck.tasks;

/**
 * A background operation of which at most one instance per {@link #kind()} may be outstanding.
 *
 * @param <P> payload produced by the task
 */
public sealed interface SingletonTask<P> extends Task
    permits LoadInstalled,
        LoadOutdated,
        Search,
        MutatePackage,
        UpdateAll,
        Maintenance,
        LoadServices,
        ServiceAction,
        ExportPackages,
        ImportPackages {

  TaskKind kind();

  /** Lower-case phrase such as "installing wget", used in log and error lines. */
  String describe();

  /** Package or service name the task acts on, if any. */
  default String target() {
    return null;
  }

  /**
   * Runs on a worker thread. Provider failures may simply propagate; the task set turns them into
   * a failed outcome.
   */
  TaskOutcome<P> run(TaskContext ctx) throws InterruptedException;

  /** Folds a finished outcome into this frame's result. Logs are merged by the caller. */
  default void merge(TaskOutcome<P> outcome, TaskResult.Builder result) {
    result.completion(new Completion(kind(), target(), outcome.success(), outcome.message()));
  }
}
