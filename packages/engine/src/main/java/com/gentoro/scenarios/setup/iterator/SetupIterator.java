package com.gentoro.scenarios.setup.iterator;

import static com.gentoro.scenarios.setup.xml.XmlAttributes.attr;

import com.gentoro.scenarios.exception.ConfigException;
import java.util.List;
import org.w3c.dom.Element;

/**
 * A named generator of an ordered, finite sequence of formatted string values, declared by an
 * {@code <iterator>} element of a setup document.
 *
 * <p>Values are computed once at construction and can be iterated any number of times.
 */
public abstract class SetupIterator {

  private final String name;
  private final IteratorType type;

  protected SetupIterator(String name, IteratorType type) {
    if (name == null || name.isBlank()) {
      throw new ConfigException("<iterator> element is missing required attribute 'name'");
    }
    this.name = name;
    this.type = type;
  }

  public String name() {
    return name;
  }

  public IteratorType type() {
    return type;
  }

  /** The formatted values, in generation order. Never empty. */
  public abstract List<String> values();

  /** Build the iterator variant matching the element's {@code type} attribute. */
  public static SetupIterator fromElement(Element node) {
    String name = attr(node, "name");
    String typeName = attr(node, "type");
    IteratorType type = IteratorType.fromXml(typeName);
    if (type == null) {
      throw new ConfigException(
              "Iterator '%s': type must be one of int, float or list, got '%s'"
                  .formatted(name, typeName))
          .withContext("iterator", name);
    }
    if (type == IteratorType.LIST) {
      return new ValueListIterator(name, attr(node, "values"));
    }
    return new NumericIterator(
        name, type, attr(node, "min"), attr(node, "max"), attr(node, "step"), attr(node, "format"));
  }
}
