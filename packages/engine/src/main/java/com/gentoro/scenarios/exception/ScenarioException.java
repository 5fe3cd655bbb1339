package com.gentoro.scenarios.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base runtime exception for the scenario setup engine.
 *
 * <p>Every exception carries a {@link ScenarioErrorCode} and an optional context map holding the
 * identifying attributes of the node that caused the failure (group, scenario, iterator, tag...).
 */
public class ScenarioException extends RuntimeException {

  private final ScenarioErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ScenarioException(ScenarioErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ScenarioException(ScenarioErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ScenarioErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach an identifying attribute and return this exception for fluent throwing. */
  public ScenarioException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.put(key, value);
    }
    return this;
  }
}
