package com.gentoro.scenarios.setup.action;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.required;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.setup.template.PlaceholderFormatter;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import java.util.Map;
import org.w3c.dom.Element;

/** {@code <insert name="..." after="...">file</insert>}: insert a component after another one. */
public class InsertAction extends ConfigAction {

  private final String rawAfter;
  private String after;

  public InsertAction(Element node) {
    super(node);
    this.rawAfter = required(node, "after");
  }

  public String after() {
    return after != null ? after : rawAfter;
  }

  @Override
  protected void formatFields(Map<String, String> context) {
    super.formatFields(context);
    this.after = PlaceholderFormatter.format(rawAfter, context);
  }

  @Override
  protected void apply(ConfigEditor editor, String content) {
    editor.insertScenarioComponent(name(), content, after());
  }

  @Override
  public String toString() {
    return "<%s name=\"%s\" after=\"%s\"%s>%s</%s>"
        .formatted(
            tag(),
            SetupXmlWriter.escape(name()),
            SetupXmlWriter.escape(after()),
            dynamicAttribute(),
            SetupXmlWriter.escape(content()),
            tag());
  }
}
