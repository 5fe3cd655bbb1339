package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.setup.template.PlaceholderFormatter;
import com.gentoro.scenarios.setup.xml.SetupXmlWriter;
import java.util.Map;

/**
 * One step of a scenario, built from an action element of the setup document.
 *
 * <p>Textual fields are formatted against the template context once, during expansion. Later
 * calls to {@link #formatContent(Map)} keep the cached result, so text that expanded into literal
 * braces is never substituted twice.
 */
public abstract class Action {

  private final String tag;
  private final String content;
  private String formattedContent;
  private boolean formatted;

  protected Action(String tag, String content) {
    this.tag = tag;
    this.content = content;
  }

  public String tag() {
    return tag;
  }

  /** Raw text content as declared in the document. */
  public String rawContent() {
    return content;
  }

  /** Formatted content, or the raw content when not yet formatted. */
  public String content() {
    return formatted ? formattedContent : content;
  }

  public boolean isFormatted() {
    return formatted;
  }

  public boolean isDynamic() {
    return false;
  }

  public void formatContent(Map<String, String> context) {
    if (formatted) return;
    formattedContent = PlaceholderFormatter.format(content, context);
    formatFields(context);
    formatted = true;
  }

  /** Content as formatted by the current {@link #formatContent(Map)} call. */
  protected String formattedContent() {
    return formattedContent;
  }

  /** Hook for subclasses formatting additional attributes; runs once. */
  protected void formatFields(Map<String, String> context) {}

  /**
   * Apply this action to {@code editor}.
   *
   * @param directories run-time values for {@code scenarioDir} and {@code baselineDir}
   * @param phase the pass currently being replayed
   */
  public abstract void run(ConfigEditor editor, Map<String, String> directories, SetupPhase phase);

  /** Append the expanded form of this action. */
  public void writeXml(SetupXmlWriter out, int indent) {
    out.line(indent, toString());
  }
}
