package com.gentoro.scenarios.exception;

/** Stable error codes reported by {@link ScenarioException} and its subclasses. */
public enum ScenarioErrorCode {
  /** Malformed setup document, missing attribute, unknown capability or provider. */
  CONFIG_ERROR,
  /** Unknown group, scenario or iterator referenced by name. */
  LOOKUP_ERROR,
  /** A configuration editor failed to apply a mutation. */
  EXECUTION_ERROR,
  /** Reading or writing a setup document failed. */
  IO_ERROR,
  UNKNOWN
}
