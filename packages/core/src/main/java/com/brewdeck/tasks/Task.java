package com.brewdeck.tasks;

/**
 * Description of one unit of background work submitted to the {@link TaskCoordinator}. Singleton
 * tasks run at most once per {@link TaskKind}; {@link LoadItemDetail} lookups go through the
 * bounded enrichment queue.
 */
public sealed interface Task permits SingletonTask, LoadItemDetail {}
