package com.gentoro.scenarios.exception;

/** A group, scenario or iterator name could not be resolved. */
public class LookupException extends ScenarioException {
  public LookupException(String message) {
    super(ScenarioErrorCode.LOOKUP_ERROR, message);
  }
}
