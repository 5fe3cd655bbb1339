package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.editor.ConfigEditor;
import org.w3c.dom.Element;

/** {@code <add name="...">file</add>}: append a scenario component. */
public class AddAction extends ConfigAction {
  public AddAction(Element node) {
    super(node);
  }

  @Override
  protected void apply(ConfigEditor editor, String content) {
    editor.addScenarioComponent(name(), content);
  }
}
