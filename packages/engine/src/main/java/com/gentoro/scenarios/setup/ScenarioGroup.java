package com.gentoro.scenarios.setup;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.attr;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.bool;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.required;

import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.exception.LookupException;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.action.ActionRegistry;
import com.gentoro.scenarios.setup.template.CrossProductExpander;
import com.gentoro.scenarios.setup.template.PlaceholderFormatter;
import com.gentoro.scenarios.setup.template.TemplateContext;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import com.gentoro.scenarios.setup.xml.XmlAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.w3c.dom.Element;

/**
 * A named collection of scenarios, built from a {@code <scenarioGroup>} element.
 *
 * <p>Scenario templates are kept as parsed; {@link #expandScenarios} turns them into the final,
 * iterator-free scenarios keyed by name. When two expansions produce the same name the later one
 * replaces the earlier one.
 */
public class ScenarioGroup {
  private static final Logger log = LoggingService.getLogger(ScenarioGroup.class);

  private final Element node;
  private final ActionRegistry registry;
  private final boolean useGroupDir;
  private final boolean isDefault;
  private final String iteratorName;
  private final String baselineSource;
  private final List<Scenario> templateScenarios = new ArrayList<>();
  private final Map<String, Scenario> finalScenarios = new LinkedHashMap<>();
  private String name;

  public ScenarioGroup(Element node, ActionRegistry registry) {
    this.node = node;
    this.registry = registry;
    this.name = required(node, "name");
    this.useGroupDir = bool(node, "useGroupDir", false);
    this.isDefault = bool(node, "default", false);
    this.iteratorName = attr(node, "iterator");
    this.baselineSource = attr(node, "baselineSource");
    try {
      for (Element scenarioNode : XmlAttributes.children(node, "scenario")) {
        templateScenarios.add(new Scenario(scenarioNode, registry));
      }
    } catch (ConfigException e) {
      throw e.withContext("group", name);
    }
  }

  Element node() {
    return node;
  }

  public String name() {
    return name;
  }

  void rename(String finalName) {
    this.name = finalName;
  }

  public boolean useGroupDir() {
    return useGroupDir;
  }

  public boolean isDefault() {
    return isDefault;
  }

  public String iteratorName() {
    return iteratorName;
  }

  /** Optional {@code "groupName/scenarioName"} reference to a baseline owned by another group. */
  public String baselineSource() {
    return baselineSource;
  }

  public List<Scenario> templateScenarios() {
    return Collections.unmodifiableList(templateScenarios);
  }

  /** Final scenarios in expansion order. */
  public Map<String, Scenario> scenarios() {
    return Collections.unmodifiableMap(finalScenarios);
  }

  public Scenario getFinalScenario(String scenarioName) {
    Scenario scenario = scenarioName == null ? null : finalScenarios.get(scenarioName);
    if (scenario == null) {
      throw new LookupException(
              "Scenario \"%s\" was not found in group \"%s\"".formatted(scenarioName, name))
          .withContext("group", name)
          .withContext("scenario", scenarioName);
    }
    return scenario;
  }

  /**
   * Expand every scenario template into final scenarios. Iterator placeholders are substituted;
   * {@code {scenarioDir}} and {@code {baselineDir}} are left for run time.
   */
  public void expandScenarios(CrossProductExpander expander, TemplateContext context) {
    for (Scenario template : templateScenarios) {
      Supplier<Scenario> factory =
          template.iteratorName() == null
              ? () -> template
              : () -> new Scenario(template.node(), registry);

      expander.expand(
          template.iteratorName(),
          factory,
          scenario -> {
            String finalName;
            try {
              finalName = PlaceholderFormatter.format(scenario.name(), context.asMap());
            } catch (ConfigException e) {
              throw e.withContext("group", name).withContext("scenario", scenario.name());
            }
            scenario.rename(finalName);
            if (finalScenarios.put(finalName, scenario) != null) {
              log.debug(
                  "Scenario '{}' in group '{}' replaced by a later expansion", finalName, name);
            }
            try {
              scenario.formatContent(context.asMap());
            } catch (ConfigException e) {
              throw e.withContext("group", name);
            }
          });
    }
  }

  public void writeXml(SetupXmlWriter out, int indent) {
    out.blank();
    out.line(
        indent,
        "<scenarioGroup name=\"%s\" useGroupDir=\"%d\">"
            .formatted(SetupXmlWriter.escape(name), useGroupDir ? 1 : 0));
    for (Scenario scenario : finalScenarios.values()) {
      scenario.writeXml(out, indent + 1);
    }
    out.line(indent, "</scenarioGroup>");
  }
}
