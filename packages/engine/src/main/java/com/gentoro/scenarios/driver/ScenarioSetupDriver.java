package com.gentoro.scenarios.driver;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.editor.ConfigEditorFactory;
import com.gentoro.scenarios.editor.EditorTarget;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.Scenario;
import com.gentoro.scenarios.setup.ScenarioGroup;
import com.gentoro.scenarios.setup.ScenarioSetup;
import com.gentoro.scenarios.setup.template.TemplateContext;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * Prepares scenario runs against the editors produced by a {@link ConfigEditorFactory}.
 *
 * <p>A non-baseline scenario gets its group's baseline as parent. A baseline whose group declares
 * {@code baselineSource="group/scenario"} gets that scenario as parent instead, which must itself
 * be a baseline. With a parent, {@code {baselineDir}} resolves to the parent's scenario directory.
 */
public class ScenarioSetupDriver {
  private static final Logger log = LoggingService.getLogger(ScenarioSetupDriver.class);

  private final ScenarioSetup setup;
  private final ConfigEditorFactory editors;
  private final DriverSettings settings;
  private final DirectoryLayout layout;

  public ScenarioSetupDriver(
      ScenarioSetup setup, ConfigEditorFactory editors, DriverSettings settings) {
    this.setup = setup;
    this.editors = editors;
    this.settings = settings;
    this.layout = new DirectoryLayout(settings.xmlOutputRoot());
  }

  public ScenarioRun open(@NotNull EditorTarget target) {
    String groupName = target.groupName();
    if (groupName == null || groupName.isBlank()) {
      groupName = setup.defaultGroupName();
    }
    ScenarioGroup group = setup.group(groupName);
    EditorTarget resolved = target.withGroupName(group.name());
    String subdir = resolved.subdir();

    ConfigEditor parent = null;
    String parentDir = null;
    if (!resolved.isBaseline()) {
      parent = editors.resolveParent(EditorTarget.baseline(group.name(), resolved.baseline()));
      parentDir = layout.scenarioDir(group, subdir, resolved.baseline());
    } else if (group.baselineSource() != null && !group.baselineSource().isBlank()) {
      String[] source = parseBaselineSource(group);
      ScenarioGroup sourceGroup = setup.group(source[0]);
      Scenario sourceScenario = sourceGroup.getFinalScenario(source[1]);
      if (!sourceScenario.isBaseline()) {
        throw new ConfigException(
                "baselineSource \"%s\" of group \"%s\" refers to a scenario that is not a baseline"
                    .formatted(group.baselineSource(), group.name()))
            .withContext("group", group.name())
            .withContext("baselineSource", group.baselineSource());
      }
      log.info("Group {} inherits from baseline {}", group.name(), group.baselineSource());
      parent =
          editors.resolveParent(EditorTarget.baseline(sourceGroup.name(), sourceScenario.name()));
      parentDir = layout.scenarioDir(sourceGroup, subdir, sourceScenario.name());
    }

    ConfigEditor editor = editors.create(resolved, parent);

    Map<String, String> directories = new LinkedHashMap<>();
    directories.put(
        TemplateContext.SCENARIO_DIR, layout.scenarioDir(group, subdir, resolved.scenarioName()));
    directories.put(
        TemplateContext.BASELINE_DIR,
        parentDir != null ? parentDir : layout.scenarioDir(group, subdir, resolved.baseline()));

    return new ScenarioRun(setup, group, editor, parent, directories, settings);
  }

  private static String[] parseBaselineSource(ScenarioGroup group) {
    String[] parts = group.baselineSource().split("/", -1);
    if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
      throw new ConfigException(
              "baselineSource error: \"%s\"; should be of the form \"groupName/baselineName\""
                  .formatted(group.baselineSource()))
          .withContext("group", group.name())
          .withContext("baselineSource", group.baselineSource());
    }
    return new String[] {parts[0].trim(), parts[1].trim()};
  }
}
