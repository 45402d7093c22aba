package com.brewdeck.exception;

/** Coarse classification of failures raised inside BrewDeck. */
public enum BrewDeckErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  /** The background runtime could not accept work. Not recoverable. */
  EXECUTOR_UNAVAILABLE,
  /** An external provider call failed. */
  PROVIDER_ERROR,
  PACKAGE_LIST_ERROR
}
