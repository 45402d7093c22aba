package com.brewdeck.tasks;

/**
 * Marker that a mutating singleton finished.
 *
 * @param target package or service the task acted on, {@code null} for whole-system operations
 */
public record Completion(TaskKind kind, String target, boolean success, String message) {}
