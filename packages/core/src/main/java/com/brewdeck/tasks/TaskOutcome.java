package com.brewdeck.tasks;

import java.util.List;

/**
 * Everything a singleton worker hands back. Written once into the task's {@link ResultCell}; its
 * presence is the completion signal.
 *
 * @param payload the task's result, {@code null} when the task failed before producing one
 * @param logs human-readable lines produced while the task ran
 */
public record TaskOutcome<P>(boolean success, P payload, String message, List<String> logs) {
  public TaskOutcome {
    message = message == null ? "" : message;
    logs = logs == null ? List.of() : List.copyOf(logs);
  }
}
