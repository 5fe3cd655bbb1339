package com.gentoro.scenarios.editor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Test editor that records every call as a readable string. */
public class RecordingConfigEditor implements ConfigEditor {

  private final EditorTarget target;
  private final ConfigEditor parent;
  private final List<String> calls = new ArrayList<>();
  private final CapabilityRegistry<RecordingConfigEditor> capabilities =
      new CapabilityRegistry<RecordingConfigEditor>()
          .register(
              "record",
              (editor, args) -> editor.calls.add("record" + args.positional() + args.keywords()));

  public RecordingConfigEditor(EditorTarget target, ConfigEditor parent) {
    this.target = target;
    this.parent = parent;
  }

  public RecordingConfigEditor(String groupName, String scenario) {
    this(EditorTarget.baseline(groupName, scenario), null);
  }

  public List<String> calls() {
    return calls;
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
    calls.add("insert(%s,%s,%s)".formatted(name, content, afterName));
  }

  @Override
  public void addScenarioComponent(String name, String content) {
    calls.add("add(%s,%s)".formatted(name, content));
  }

  @Override
  public void updateScenarioComponent(String name, String content) {
    calls.add("update(%s,%s)".formatted(name, content));
  }

  @Override
  public void deleteScenarioComponent(String name) {
    calls.add("delete(%s)".formatted(name));
  }

  @Override
  public Optional<Capability> capability(String name) {
    return capabilities.bind(name, this);
  }
}
