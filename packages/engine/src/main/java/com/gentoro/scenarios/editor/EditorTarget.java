package com.gentoro.scenarios.editor;

/**
 * Identifies the scenario an editor works on.
 *
 * @param groupName group name, or {@code null} for the setup document's default group
 * @param baseline name of the group's baseline scenario
 * @param scenario name of the non-baseline scenario, or {@code null} when editing the baseline
 * @param subdir optional sub-directory inserted into the scenario directory, may be empty
 */
public record EditorTarget(String groupName, String baseline, String scenario, String subdir) {

  public static EditorTarget baseline(String groupName, String baseline) {
    return new EditorTarget(groupName, baseline, null, "");
  }

  public static EditorTarget scenario(String groupName, String baseline, String scenario) {
    return new EditorTarget(groupName, baseline, scenario, "");
  }

  public EditorTarget withGroupName(String name) {
    return new EditorTarget(name, baseline, scenario, subdir);
  }

  public boolean isBaseline() {
    return scenario == null || scenario.isBlank();
  }

  /** Name of the scenario actually being edited. */
  public String scenarioName() {
    return isBaseline() ? baseline : scenario;
  }
}
