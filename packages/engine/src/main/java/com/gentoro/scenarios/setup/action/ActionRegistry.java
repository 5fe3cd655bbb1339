package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.setup.xml.XmlAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.w3c.dom.Element;

/**
 * Maps action element tags to their constructors. Unknown tags are rejected when the document is
 * loaded, not when the scenario runs.
 */
public class ActionRegistry {

  /** Builds an action from its element; receives the registry for nested children. */
  @FunctionalInterface
  public interface ActionFactory {
    Action create(Element node, ActionRegistry registry);
  }

  private final Map<String, ActionFactory> factories = new LinkedHashMap<>();

  /** Registry with the built-in insert, add, replace, delete, function and if actions. */
  public static ActionRegistry defaults() {
    return new ActionRegistry()
        .register("insert", (node, registry) -> new InsertAction(node))
        .register("add", (node, registry) -> new AddAction(node))
        .register("replace", (node, registry) -> new ReplaceAction(node))
        .register("delete", (node, registry) -> new DeleteAction(node))
        .register("function", (node, registry) -> new FunctionAction(node))
        .register("if", IfAction::new);
  }

  public ActionRegistry register(String tag, ActionFactory factory) {
    factories.put(tag, factory);
    return this;
  }

  public Set<String> tags() {
    return Collections.unmodifiableSet(factories.keySet());
  }

  public Action create(Element node) {
    ActionFactory factory = factories.get(node.getTagName());
    if (factory == null) {
      throw new ConfigException(
              "Unknown action <%s>; expected one of %s".formatted(node.getTagName(), tags()))
          .withContext("tag", node.getTagName());
    }
    return factory.create(node, this);
  }

  /** Build every child element of {@code parent} as an action, in document order. */
  public List<Action> createChildren(Element parent) {
    List<Action> actions = new ArrayList<>();
    for (Element child : XmlAttributes.children(parent, null)) {
      actions.add(create(child));
    }
    return actions;
  }
}
