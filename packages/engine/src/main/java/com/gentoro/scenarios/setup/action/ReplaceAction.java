package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.editor.ConfigEditor;
import org.w3c.dom.Element;

/** {@code <replace name="...">file</replace>}: point an existing component at new content. */
public class ReplaceAction extends ConfigAction {
  public ReplaceAction(Element node) {
    super(node);
  }

  @Override
  protected void apply(ConfigEditor editor, String content) {
    editor.updateScenarioComponent(name(), content);
  }
}
