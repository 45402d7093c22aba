package com.brewdeck.exception;

/** Errors reported by an external package, service or package-list provider. */
public class ProviderException extends BrewDeckException {
  public ProviderException(String message) {
    super(BrewDeckErrorCode.PROVIDER_ERROR, message);
  }

  public ProviderException(String message, Throwable cause) {
    super(BrewDeckErrorCode.PROVIDER_ERROR, message, cause);
  }
}
