package com.gentoro.scenarios.setup.action;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.bool;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.required;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.setup.template.PlaceholderFormatter;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/**
 * {@code <if value1="..." value2="a,b" matches="1">...</if>}: conditional group of actions.
 *
 * <p>The condition is {@code (value1 in split(value2)) == matches}. It is evaluated in both
 * phases; the children still filter themselves by phase.
 */
public class IfAction extends Action {

  private final String rawValue1;
  private final String rawValue2;
  private final boolean matches;
  private final List<Action> actions;
  private String value1;
  private String value2;

  public IfAction(Element node, ActionRegistry registry) {
    super(node.getTagName(), null);
    this.rawValue1 = required(node, "value1");
    this.rawValue2 = required(node, "value2");
    this.matches = bool(node, "matches", true);
    this.actions = Collections.unmodifiableList(registry.createChildren(node));
  }

  public String value1() {
    return value1 != null ? value1 : rawValue1;
  }

  public String value2() {
    return value2 != null ? value2 : rawValue2;
  }

  public boolean matches() {
    return matches;
  }

  public List<Action> actions() {
    return actions;
  }

  public boolean isSatisfied() {
    List<String> alternatives = Arrays.stream(value2().split(",")).map(String::trim).toList();
    return alternatives.contains(value1()) == matches;
  }

  @Override
  protected void formatFields(Map<String, String> context) {
    this.value1 = PlaceholderFormatter.format(rawValue1, context);
    this.value2 = PlaceholderFormatter.format(rawValue2, context);
    for (Action action : actions) {
      action.formatContent(context);
    }
  }

  @Override
  public void run(ConfigEditor editor, Map<String, String> directories, SetupPhase phase) {
    if (!isSatisfied()) return;
    for (Action action : actions) {
      action.run(editor, directories, phase);
    }
  }

  /** Only the children that are active are written; the {@code <if>} itself is dropped. */
  @Override
  public void writeXml(SetupXmlWriter out, int indent) {
    if (!isSatisfied()) return;
    for (Action action : actions) {
      action.writeXml(out, indent);
    }
  }

  @Override
  public String toString() {
    return "<%s value1=\"%s\" value2=\"%s\" matches=\"%d\"/>"
        .formatted(
            tag(),
            SetupXmlWriter.escape(value1()),
            SetupXmlWriter.escape(value2()),
            matches ? 1 : 0);
  }
}
