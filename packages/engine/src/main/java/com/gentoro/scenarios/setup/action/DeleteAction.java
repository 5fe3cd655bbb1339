package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import org.w3c.dom.Element;

/** {@code <delete name="..."/>}: remove a scenario component. */
public class DeleteAction extends ConfigAction {
  public DeleteAction(Element node) {
    super(node);
  }

  @Override
  protected void apply(ConfigEditor editor, String content) {
    editor.deleteScenarioComponent(name());
  }

  @Override
  public String toString() {
    return "<%s name=\"%s\"%s/>"
        .formatted(tag(), SetupXmlWriter.escape(name()), dynamicAttribute());
  }
}
