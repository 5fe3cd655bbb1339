package com.gentoro.scenarios.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of a failure. */
public record ErrorDetails(
    String type,
    String message,
    ScenarioErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
