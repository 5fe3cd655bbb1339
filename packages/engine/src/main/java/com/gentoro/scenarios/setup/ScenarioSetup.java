package com.gentoro.scenarios.setup;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.attr;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.exception.LookupException;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.action.ActionRegistry;
import com.gentoro.scenarios.setup.action.SetupPhase;
import com.gentoro.scenarios.setup.iterator.SetupIterator;
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
 * Parsed and fully expanded setup document.
 *
 * <p>Construction reads the declared iterators, builds the group templates and expands them, with
 * their scenarios, into final groups keyed by name. The template context is shared by the whole
 * expansion, so an instance must not be built or run from more than one thread at a time.
 */
public class ScenarioSetup {
  private static final Logger log = LoggingService.getLogger(ScenarioSetup.class);

  private final String name;
  private final String defaultGroup;
  private final TemplateContext templateContext = new TemplateContext();
  private final Map<String, SetupIterator> iterators = new LinkedHashMap<>();
  private final Map<String, ScenarioGroup> groups = new LinkedHashMap<>();

  public ScenarioSetup(Element root, ActionRegistry registry) {
    this.name = attr(root, "name", "");
    this.defaultGroup = attr(root, "defaultGroup");

    for (Element iteratorNode : XmlAttributes.children(root, "iterator")) {
      SetupIterator iterator = SetupIterator.fromElement(iteratorNode);
      if (iterators.put(iterator.name(), iterator) != null) {
        log.warn("Iterator '{}' is declared more than once, keeping the last", iterator.name());
      }
    }

    List<ScenarioGroup> templateGroups = new ArrayList<>();
    for (Element groupNode : XmlAttributes.children(root, "scenarioGroup")) {
      templateGroups.add(new ScenarioGroup(groupNode, registry));
    }
    expandGroups(templateGroups, registry);

    if (log.isDebugEnabled()) {
      int scenarios = groups.values().stream().mapToInt(g -> g.scenarios().size()).sum();
      log.debug(
          "Expanded setup '{}' into {} group(s), {} scenario(s)", name, groups.size(), scenarios);
    }
  }

  public static ScenarioSetup fromElement(Element root) {
    return new ScenarioSetup(root, ActionRegistry.defaults());
  }

  public String name() {
    return name;
  }

  public TemplateContext templateContext() {
    return templateContext;
  }

  public Map<String, SetupIterator> iterators() {
    return Collections.unmodifiableMap(iterators);
  }

  public SetupIterator getIterator(String iteratorName) {
    SetupIterator iterator = iterators.get(iteratorName);
    if (iterator == null) {
      throw new LookupException("Iterator '%s' is not defined".formatted(iteratorName))
          .withContext("iterator", iteratorName);
    }
    return iterator;
  }

  /** Final groups in expansion order. */
  public Map<String, ScenarioGroup> groups() {
    return Collections.unmodifiableMap(groups);
  }

  public ScenarioGroup group(String groupName) {
    ScenarioGroup group = groupName == null ? null : groups.get(groupName);
    if (group == null) {
      throw new LookupException("Scenario group \"%s\" is not defined".formatted(groupName))
          .withContext("group", groupName);
    }
    return group;
  }

  /**
   * Name of the group used when the editor does not request one: the {@code defaultGroup}
   * attribute of the document, else the first group flagged {@code default}.
   */
  public String defaultGroupName() {
    if (defaultGroup != null && !defaultGroup.isBlank()) return defaultGroup;
    return groups.values().stream()
        .filter(ScenarioGroup::isDefault)
        .map(ScenarioGroup::name)
        .findFirst()
        .orElse(null);
  }

  /** Group requested by the editor, falling back to the default group. */
  public ScenarioGroup groupFor(ConfigEditor editor) {
    String groupName = editor.groupName();
    if (groupName == null || groupName.isBlank()) {
      groupName = defaultGroupName();
      if (groupName == null) {
        throw new LookupException(
            "No scenario group was requested and the setup declares no default group");
      }
    }
    return group(groupName);
  }

  /**
   * Run the actions of the scenario selected by {@code editor} for one phase.
   *
   * @param directories values of {@code scenarioDir} and {@code baselineDir}
   */
  public void run(ConfigEditor editor, Map<String, String> directories, SetupPhase phase) {
    ScenarioGroup group = groupFor(editor);
    String scenarioName = editor.scenario();
    if (scenarioName == null || scenarioName.isBlank()) {
      scenarioName = editor.baseline();
    }
    Scenario scenario = group.getFinalScenario(scenarioName);
    log.debug("Running {} actions of {}/{}", phase, group.name(), scenario.name());
    scenario.run(editor, directories, phase);
  }

  private void expandGroups(List<ScenarioGroup> templateGroups, ActionRegistry registry) {
    CrossProductExpander expander = new CrossProductExpander(templateContext, this::getIterator);

    for (ScenarioGroup template : templateGroups) {
      Supplier<ScenarioGroup> factory =
          template.iteratorName() == null
              ? () -> template
              : () -> new ScenarioGroup(template.node(), registry);

      expander.expand(
          template.iteratorName(),
          factory,
          group -> {
            String finalName;
            try {
              finalName = PlaceholderFormatter.format(group.name(), templateContext.asMap());
            } catch (ConfigException e) {
              throw e.withContext("group", group.name());
            }
            group.rename(finalName);
            group.expandScenarios(expander, templateContext);
            if (groups.put(finalName, group) != null) {
              log.debug("Scenario group '{}' replaced by a later expansion", finalName);
            }
          });
    }
  }

  /** Write the expanded, iterator-free setup. */
  public void writeXml(SetupXmlWriter out, int indent) {
    out.line(indent, "<setup>");
    for (ScenarioGroup group : groups.values()) {
      group.writeXml(out, indent + 1);
    }
    out.line(indent, "</setup>");
  }

  public String toXml() {
    SetupXmlWriter out = new SetupXmlWriter();
    writeXml(out, 0);
    return out.toString();
  }
}
