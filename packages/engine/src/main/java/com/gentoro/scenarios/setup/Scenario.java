package com.gentoro.scenarios.setup;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.attr;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.bool;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.required;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.setup.action.Action;
import com.gentoro.scenarios.setup.action.ActionRegistry;
import com.gentoro.scenarios.setup.action.SetupPhase;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/** A named, ordered sequence of actions, built from a {@code <scenario>} element. */
public class Scenario {

  private final Element node;
  private final boolean baseline;
  private final String iteratorName;
  private final List<Action> actions;
  private String name;

  public Scenario(Element node, ActionRegistry registry) {
    this.node = node;
    this.name = required(node, "name");
    this.baseline = bool(node, "baseline", false);
    this.iteratorName = attr(node, "iterator");
    try {
      this.actions = Collections.unmodifiableList(registry.createChildren(node));
    } catch (ConfigException e) {
      throw e.withContext("scenario", name);
    }
  }

  /** The template element this scenario was built from. */
  Element node() {
    return node;
  }

  public String name() {
    return name;
  }

  void rename(String finalName) {
    this.name = finalName;
  }

  public boolean isBaseline() {
    return baseline;
  }

  public String iteratorName() {
    return iteratorName;
  }

  public List<Action> actions() {
    return actions;
  }

  /** Format every action against the expansion context. Directories stay as placeholders. */
  public void formatContent(Map<String, String> context) {
    for (Action action : actions) {
      try {
        action.formatContent(context);
      } catch (ConfigException e) {
        throw e.withContext("scenario", name);
      }
    }
  }

  /** Run the actions in order; the first failure aborts the remaining ones. */
  public void run(ConfigEditor editor, Map<String, String> directories, SetupPhase phase) {
    for (Action action : actions) {
      action.run(editor, directories, phase);
    }
  }

  public void writeXml(SetupXmlWriter out, int indent) {
    out.line(
        indent,
        "<scenario name=\"%s\" baseline=\"%d\">"
            .formatted(SetupXmlWriter.escape(name), baseline ? 1 : 0));
    for (Action action : actions) {
      action.writeXml(out, indent + 1);
    }
    out.line(indent, "</scenario>");
  }

  @Override
  public String toString() {
    return "<scenario name='%s'>".formatted(name);
  }
}
