package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.editor.Capability;
import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.editor.FunctionArguments;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.setup.template.PlaceholderFormatter;
import com.gentoro.scenarios.setup.template.TemplateContext;
import java.util.Map;
import org.w3c.dom.Element;

/**
 * {@code <function name="capability">args</function>}: invoke a named editor capability with a
 * literal argument list.
 *
 * <p>The argument text is checked when the action is formatted, with the directory placeholders
 * standing in for their run-time values, and parsed again with the resolved text when it runs.
 */
public class FunctionAction extends ConfigAction {
  private static final Map<String, String> DIRECTORY_STANDINS =
      Map.of(
          TemplateContext.SCENARIO_DIR, TemplateContext.SCENARIO_DIR,
          TemplateContext.BASELINE_DIR, TemplateContext.BASELINE_DIR);

  public FunctionAction(Element node) {
    super(node);
  }

  @Override
  protected void formatFields(Map<String, String> context) {
    super.formatFields(context);
    arguments(PlaceholderFormatter.resolve(formattedContent(), DIRECTORY_STANDINS));
  }

  /** Parsed arguments of the current content. */
  public FunctionArguments arguments(String content) {
    try {
      return FunctionArgumentParser.parse(content);
    } catch (ConfigException e) {
      throw e.withContext("function", name());
    }
  }

  @Override
  protected void apply(ConfigEditor editor, String content) {
    Capability capability =
        editor
            .capability(name())
            .orElseThrow(
                () ->
                    new ConfigException(
                            ("<function name='%s'>: function doesn't exist"
                                    + " or is not callable from XML")
                                .formatted(name()))
                        .withContext("function", name()));
    capability.invoke(arguments(content));
  }
}
