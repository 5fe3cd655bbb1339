package com.gentoro.scenarios.editor;

import java.util.Optional;

/**
 * Narrow mutation interface through which scenario actions modify a scenario's configuration.
 *
 * <p>An editor is bound to one {@link EditorTarget}: the group, baseline and (for non-baseline
 * runs) scenario it edits. How the edited configuration is persisted is up to the
 * implementation.
 */
public interface ConfigEditor {

  /** The target this editor is bound to. */
  EditorTarget target();

  /** Editor of the scenario this one inherits from, if any. */
  Optional<ConfigEditor> parent();

  default String groupName() {
    return target().groupName();
  }

  default String scenario() {
    return target().scenario();
  }

  default String baseline() {
    return target().baseline();
  }

  void insertScenarioComponent(String name, String content, String afterName);

  void addScenarioComponent(String name, String content);

  void updateScenarioComponent(String name, String content);

  void deleteScenarioComponent(String name);

  /**
   * Look up a capability that may be invoked from a {@code <function>} action.
   *
   * @return the capability bound to this editor, or empty when no capability has that name
   */
  Optional<Capability> capability(String name);
}
