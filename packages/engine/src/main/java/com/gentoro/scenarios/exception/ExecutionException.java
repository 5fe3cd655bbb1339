package com.gentoro.scenarios.exception;

/** Raised by configuration editors when a mutation cannot be applied. */
public class ExecutionException extends ScenarioException {
  public ExecutionException(String message) {
    super(ScenarioErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(ScenarioErrorCode.EXECUTION_ERROR, message, cause);
  }
}
