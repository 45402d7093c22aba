package com.brewdeck.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base unchecked exception carrying an error code and optional diagnostic context. */
public class BrewDeckException extends RuntimeException {
  private final BrewDeckErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public BrewDeckException(BrewDeckErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public BrewDeckException(BrewDeckErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public BrewDeckErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value and return this exception for chaining. */
  public BrewDeckException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
