package com.gentoro.scenarios.setup.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable mapping from iterator name to its currently bound value, shared by one expansion pass
 * over a setup document.
 *
 * <p>The context is seeded with the deferred placeholders {@code scenarioDir} and {@code
 * baselineDir}, which map to themselves so that expansion leaves them in place until run time.
 *
 * <p>Not thread-safe. Nested iterator loops overwrite their entry in place, so anything formatted
 * from the context must be formatted before the enclosing loop advances. Concurrent expansion
 * needs a {@link #copy()} per branch.
 */
public class TemplateContext {

  public static final String SCENARIO_DIR = "scenarioDir";
  public static final String BASELINE_DIR = "baselineDir";

  private final Map<String, String> values = new LinkedHashMap<>();

  public TemplateContext() {
    values.put(SCENARIO_DIR, "{" + SCENARIO_DIR + "}");
    values.put(BASELINE_DIR, "{" + BASELINE_DIR + "}");
  }

  private TemplateContext(Map<String, String> source) {
    values.putAll(source);
  }

  public void bind(String name, String value) {
    values.put(name, value);
  }

  public String get(String name) {
    return values.get(name);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(values);
  }

  public TemplateContext copy() {
    return new TemplateContext(values);
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
