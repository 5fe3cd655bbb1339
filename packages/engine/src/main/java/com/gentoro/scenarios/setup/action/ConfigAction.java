package com.gentoro.scenarios.setup.action;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.bool;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.required;
import static com.gentoro.scenarios.setup.xml.XmlAttributes.text;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.template.PlaceholderFormatter;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import java.util.Map;
import org.slf4j.Logger;
import org.w3c.dom.Element;

/**
 * Base of the named, phase-filtered actions. The action only runs in the pass matching its
 * {@code dynamic} attribute; directory placeholders are filled in at that point.
 */
public abstract class ConfigAction extends Action {
  private static final Logger log = LoggingService.getLogger(ConfigAction.class);

  private final String rawName;
  private final boolean dynamic;
  private String name;

  protected ConfigAction(Element node) {
    super(node.getTagName(), text(node));
    this.rawName = required(node, "name");
    this.dynamic = bool(node, "dynamic", false);
  }

  public String name() {
    return name != null ? name : rawName;
  }

  @Override
  public boolean isDynamic() {
    return dynamic;
  }

  @Override
  protected void formatFields(Map<String, String> context) {
    this.name = PlaceholderFormatter.format(rawName, context);
  }

  @Override
  public void run(ConfigEditor editor, Map<String, String> directories, SetupPhase phase) {
    if (dynamic != phase.isDynamic()) return;
    String resolved = PlaceholderFormatter.resolve(content(), directories);
    log.debug("[{}] <{} name='{}'> {}", phase, tag(), name(), resolved);
    apply(editor, resolved);
  }

  /** Perform the editor call with the directory-resolved content. */
  protected abstract void apply(ConfigEditor editor, String content);

  protected String dynamicAttribute() {
    return dynamic ? " dynamic=\"1\"" : "";
  }

  @Override
  public String toString() {
    return "<%s name=\"%s\"%s>%s</%s>"
        .formatted(
            tag(),
            SetupXmlWriter.escape(name()),
            dynamicAttribute(),
            SetupXmlWriter.escape(content()),
            tag());
  }
}
