package com.gentoro.scenarios.driver;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.exception.ExceptionUtil;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.ScenarioGroup;
import com.gentoro.scenarios.setup.ScenarioSetup;
import com.gentoro.scenarios.setup.action.SetupPhase;
import com.gentoro.scenarios.setup.template.TemplateContext;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * One scenario prepared for execution: its editor, optional parent editor and resolved
 * directories. The static and dynamic passes are triggered separately by the host.
 */
public class ScenarioRun {
  private static final Logger log = LoggingService.getLogger(ScenarioRun.class);

  public static final String MCS_VALUES_COMPONENT = "mcsValues";
  public static final String MCS_VALUES_FILE = "mcsValues.xml";

  private final ScenarioSetup setup;
  private final ScenarioGroup group;
  private final ConfigEditor editor;
  private final ConfigEditor parent;
  private final Map<String, String> directories;
  private final DriverSettings settings;

  ScenarioRun(
      ScenarioSetup setup,
      ScenarioGroup group,
      ConfigEditor editor,
      ConfigEditor parent,
      Map<String, String> directories,
      DriverSettings settings) {
    this.setup = setup;
    this.group = group;
    this.editor = editor;
    this.parent = parent;
    this.directories = directories;
    this.settings = settings;
  }

  public ConfigEditor editor() {
    return editor;
  }

  public Optional<ConfigEditor> parent() {
    return Optional.ofNullable(parent);
  }

  public ScenarioGroup group() {
    return group;
  }

  public Map<String, String> directories() {
    return Collections.unmodifiableMap(directories);
  }

  public String scenarioDir() {
    return directories.get(TemplateContext.SCENARIO_DIR);
  }

  public String baselineDir() {
    return directories.get(TemplateContext.BASELINE_DIR);
  }

  /**
   * Run the static pass. In Monte-Carlo mode a scenario without parent first receives the
   * {@value #MCS_VALUES_COMPONENT} component. Writes the expanded setup when an output file is
   * configured.
   */
  public void setupStatic() {
    if (settings.mcsMode() && parent == null) {
      editor.addScenarioComponent(MCS_VALUES_COMPONENT, scenarioDir() + "/" + MCS_VALUES_FILE);
    }
    runPhase(SetupPhase.STATIC);

    if (settings.outputFile() != null) {
      SetupXmlWriter out = new SetupXmlWriter();
      setup.writeXml(out, 0);
      out.writeTo(settings.outputFile());
      log.info("Wrote expanded scenario setup to {}", settings.outputFile());
    }
  }

  /** Run the dynamic pass. */
  public void setupDynamic() {
    runPhase(SetupPhase.DYNAMIC);
  }

  private void runPhase(SetupPhase phase) {
    log.info(
        "Running {} setup for {}/{} (scenarioDir={}, baselineDir={})",
        phase,
        group.name(),
        editor.target().scenarioName(),
        scenarioDir(),
        baselineDir());
    try {
      setup.run(editor, directories, phase);
    } catch (RuntimeException e) {
      log.error(
          "{} setup of {}/{} failed: {}",
          phase,
          group.name(),
          editor.target().scenarioName(),
          ExceptionUtil.toJson(e));
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      throw e;
    }
  }
}
