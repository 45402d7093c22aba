package com.brewdeck.exception;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Helpers for turning exceptions into log lines and user-facing messages. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Innermost {@code maxFrames} frames of {@code t} on one line, e.g. {@code
   * ResultCell.set:38 < TaskSet.runTask:131}. Empty for {@code null}.
   */
  public static String stackSummary(Throwable t, int maxFrames) {
    if (t == null) return "";
    return Arrays.stream(t.getStackTrace())
        .limit(Math.max(maxFrames, 1))
        .map(ExceptionUtil::frame)
        .collect(Collectors.joining(" < "));
  }

  private static String frame(StackTraceElement e) {
    String className = e.getClassName();
    String simpleName = className.substring(className.lastIndexOf('.') + 1);
    return simpleName + "." + e.getMethodName() + ":" + e.getLineNumber();
  }

  /**
   * Extract a user-facing message from a throwable, without stack trace information.
   *
   * <p>Provider failures carry the provider's own wording, so the first {@link ProviderException}
   * found in the cause chain wins. Otherwise the top-level message is used, prefixed with the
   * exception type when the throwable is not one of ours.
   *
   * @param t the throwable to extract the message from
   * @return the error message, or a default message if none is available
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable current = t;
    while (current != null) {
      if (current instanceof ProviderException && hasText(current.getMessage())) {
        return current.getMessage().trim();
      }
      current = current.getCause();
    }

    String message = t.getMessage();
    if (!hasText(message)) {
      return t.getClass().getSimpleName();
    }
    if (t instanceof BrewDeckException) {
      return message.trim();
    }
    return t.getClass().getSimpleName() + ": " + message.trim();
  }

  private static boolean hasText(String s) {
    return s != null && !s.trim().isEmpty();
  }
}
