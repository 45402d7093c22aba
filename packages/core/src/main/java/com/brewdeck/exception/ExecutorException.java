package com.brewdeck.exception;

/**
 * Raised when the background runtime cannot schedule or await work. This signals resource
 * exhaustion or a shut down executor and is treated as fatal by callers.
 */
public class ExecutorException extends BrewDeckException {
  public ExecutorException(String message) {
    super(BrewDeckErrorCode.EXECUTOR_UNAVAILABLE, message);
  }

  public ExecutorException(String message, Throwable cause) {
    super(BrewDeckErrorCode.EXECUTOR_UNAVAILABLE, message, cause);
  }
}
