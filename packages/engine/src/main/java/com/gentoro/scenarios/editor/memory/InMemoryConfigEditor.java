package com.gentoro.scenarios.editor.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.scenarios.editor.Capability;
import com.gentoro.scenarios.editor.CapabilityRegistry;
import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.editor.EditorTarget;
import com.gentoro.scenarios.exception.ExecutionException;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Default {@link ConfigEditor}: keeps the edited configuration in memory as an ordered list of
 * scenario components plus named sections of scalar settings.
 *
 * <p>An editor created with an in-memory parent starts from a copy of the parent's state.
 *
 * <p>Capabilities callable from {@code <function>}:
 *
 * <ul>
 *   <li>{@code updateConfigComponent(group, name, value)} sets a value in a section
 *   <li>{@code setStopYear(year)} sets {@code Ints/stop-year}
 * </ul>
 */
public class InMemoryConfigEditor implements ConfigEditor {
  private static final Logger log = LoggingService.getLogger(InMemoryConfigEditor.class);

  public static final String INTS_SECTION = "Ints";
  public static final String STOP_YEAR = "stop-year";

  private static final CapabilityRegistry<InMemoryConfigEditor> CAPABILITIES =
      new CapabilityRegistry<InMemoryConfigEditor>()
          .register(
              "updateConfigComponent",
              (editor, args) ->
                  editor.updateConfigComponent(
                      args.getString(0, "group"),
                      args.getString(1, "name"),
                      args.getString(2, "value")))
          .register("setStopYear", (editor, args) -> editor.setStopYear(args.getLong(0, "year")));

  private final EditorTarget target;
  private final ConfigEditor parent;
  private final List<ScenarioComponent> components = new ArrayList<>();
  private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

  public InMemoryConfigEditor(EditorTarget target, ConfigEditor parent) {
    this.target = target;
    this.parent = parent;
    if (parent instanceof InMemoryConfigEditor source) {
      components.addAll(source.components);
      source.sections.forEach((k, v) -> sections.put(k, new LinkedHashMap<>(v)));
    }
  }

  public InMemoryConfigEditor(EditorTarget target) {
    this(target, null);
  }

  @Override
  public EditorTarget target() {
    return target;
  }

  @Override
  public Optional<ConfigEditor> parent() {
    return Optional.ofNullable(parent);
  }

  @Override
  public void insertScenarioComponent(String name, String content, String afterName) {
    ensureAbsent(name);
    int index = indexOf(afterName);
    if (index < 0) {
      throw new ExecutionException(
              "Cannot insert '%s': component '%s' not found".formatted(name, afterName))
          .withContext("component", afterName);
    }
    components.add(index + 1, new ScenarioComponent(name, content));
    log.trace("{}: inserted {} after {}", target.scenarioName(), name, afterName);
  }

  @Override
  public void addScenarioComponent(String name, String content) {
    ensureAbsent(name);
    components.add(new ScenarioComponent(name, content));
    log.trace("{}: added {} -> {}", target.scenarioName(), name, content);
  }

  @Override
  public void updateScenarioComponent(String name, String content) {
    int index = indexOf(name);
    if (index < 0) {
      throw new ExecutionException("Cannot update '%s': component not found".formatted(name))
          .withContext("component", name);
    }
    components.set(index, new ScenarioComponent(name, content));
    log.trace("{}: updated {} -> {}", target.scenarioName(), name, content);
  }

  @Override
  public void deleteScenarioComponent(String name) {
    int index = indexOf(name);
    if (index < 0) {
      log.debug("{}: component {} not present, nothing to delete", target.scenarioName(), name);
      return;
    }
    components.remove(index);
    log.trace("{}: deleted {}", target.scenarioName(), name);
  }

  @Override
  public Optional<Capability> capability(String name) {
    return CAPABILITIES.bind(name, this);
  }

  public void updateConfigComponent(String group, String name, String value) {
    sections.computeIfAbsent(group, k -> new LinkedHashMap<>()).put(name, value);
    log.trace("{}: {}/{} = {}", target.scenarioName(), group, name, value);
  }

  public void setStopYear(long year) {
    updateConfigComponent(INTS_SECTION, STOP_YEAR, Long.toString(year));
  }

  public List<ScenarioComponent> components() {
    return Collections.unmodifiableList(components);
  }

  public Optional<String> component(String name) {
    int index = indexOf(name);
    return index < 0 ? Optional.empty() : Optional.ofNullable(components.get(index).content());
  }

  public Optional<String> configValue(String group, String name) {
    Map<String, String> section = sections.get(group);
    return section == null ? Optional.empty() : Optional.ofNullable(section.get(name));
  }

  /** Snapshot of the edited state as JSON. */
  public String toJson() {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    root.put("group", target.groupName());
    root.put("scenario", target.scenarioName());
    ArrayNode list = root.putArray("components");
    for (ScenarioComponent component : components) {
      list.addObject().put("name", component.name()).put("content", component.content());
    }
    ObjectNode config = root.putObject("config");
    sections.forEach(
        (group, values) -> {
          ObjectNode section = config.putObject(group);
          values.forEach((key, value) -> section.put(key, value));
        });
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize editor state", e);
    }
  }

  private int indexOf(String name) {
    for (int i = 0; i < components.size(); i++) {
      if (components.get(i).name().equals(name)) return i;
    }
    return -1;
  }

  private void ensureAbsent(String name) {
    if (indexOf(name) >= 0) {
      throw new ExecutionException("Scenario component '%s' already exists".formatted(name))
          .withContext("component", name);
    }
  }
}
