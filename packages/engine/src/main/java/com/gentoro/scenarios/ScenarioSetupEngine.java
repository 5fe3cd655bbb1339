package com.gentoro.scenarios;

import com.gentoro.scenarios.config.ConfigurationProvider;
import com.gentoro.scenarios.driver.DriverSettings;
import com.gentoro.scenarios.driver.ScenarioRun;
import com.gentoro.scenarios.driver.ScenarioSetupDriver;
import com.gentoro.scenarios.editor.ConfigEditorFactory;
import com.gentoro.scenarios.editor.EditorTarget;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.ScenarioSetup;
import com.gentoro.scenarios.setup.SetupDocumentCache;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Entry point wiring configuration, the setup document cache and the editor factory.
 *
 * <p>One engine serves a sequence of runs on a single thread. Hosts running scenarios in parallel
 * create one engine per worker so that no parsed document is shared.
 */
public class ScenarioSetupEngine {
  private static final Logger log = LoggingService.getLogger(ScenarioSetupEngine.class);

  private final Configuration configuration;
  private final SetupDocumentCache documents;
  private final ConfigEditorFactory editors;
  private final DriverSettings settings;

  public ScenarioSetupEngine(Configuration configuration) {
    this(configuration, new SetupDocumentCache(), new ConfigEditorFactory(configuration));
  }

  public ScenarioSetupEngine(
      Configuration configuration, SetupDocumentCache documents, ConfigEditorFactory editors) {
    this.configuration = configuration;
    this.documents = documents;
    this.editors = editors;
    this.settings = DriverSettings.from(configuration);
    int levels = LoggingService.applyConfiguration(configuration);
    log.trace("Applied {} logging level override(s)", levels);
  }

  /** Engine configured from a YAML file, or from the classpath {@code application.yaml}. */
  public static ScenarioSetupEngine fromConfigFile(Path configFile) {
    return new ScenarioSetupEngine(new ConfigurationProvider(configFile).config());
  }

  public Configuration configuration() {
    return configuration;
  }

  public SetupDocumentCache documents() {
    return documents;
  }

  public ConfigEditorFactory editors() {
    return editors;
  }

  public DriverSettings settings() {
    return settings;
  }

  public ScenarioSetup load(Path setupFile) {
    return documents.parse(setupFile);
  }

  /** Prepare a run of {@code target} from the setup in {@code setupFile}. */
  public ScenarioRun open(Path setupFile, EditorTarget target) {
    return new ScenarioSetupDriver(load(setupFile), editors, settings).open(target);
  }
}
