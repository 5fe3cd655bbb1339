package com.gentoro.scenarios.driver;

import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/**
 * Settings of {@link ScenarioSetupDriver}.
 *
 * @param xmlOutputRoot root of the scenario directories, as written into the configuration
 * @param mcsMode whether runs are Monte-Carlo trials
 * @param outputFile where to write the expanded setup after the static pass, or {@code null}
 */
public record DriverSettings(String xmlOutputRoot, boolean mcsMode, Path outputFile) {

  public static final String XML_OUTPUT_ROOT_KEY = "setup.xml-output-root";
  public static final String MCS_MODE_KEY = "setup.mcs-mode";
  public static final String OUTPUT_FILE_KEY = "setup.output-file";
  public static final String DEFAULT_XML_OUTPUT_ROOT = "../local-xml";

  public static DriverSettings defaults() {
    return new DriverSettings(DEFAULT_XML_OUTPUT_ROOT, false, null);
  }

  public static DriverSettings from(Configuration configuration) {
    String outputFile = configuration.getString(OUTPUT_FILE_KEY, null);
    return new DriverSettings(
        configuration.getString(XML_OUTPUT_ROOT_KEY, DEFAULT_XML_OUTPUT_ROOT),
        configuration.getBoolean(MCS_MODE_KEY, false),
        outputFile == null || outputFile.isBlank() ? null : Path.of(outputFile.trim()));
  }
}
