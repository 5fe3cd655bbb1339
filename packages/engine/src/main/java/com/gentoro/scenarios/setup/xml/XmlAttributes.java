package com.gentoro.scenarios.setup.xml;

import com.gentoro.scenarios.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** Attribute and child accessors over DOM elements of a setup document. */
public final class XmlAttributes {
  private XmlAttributes() {}

  /** Attribute value, or {@code null} when the attribute is absent. */
  public static String attr(Element node, String name) {
    return node.hasAttribute(name) ? node.getAttribute(name) : null;
  }

  public static String attr(Element node, String name, String defaultValue) {
    String value = attr(node, name);
    return value == null ? defaultValue : value;
  }

  /** Attribute that must be present and non-blank. */
  public static String required(Element node, String name) {
    String value = attr(node, name);
    if (value == null || value.isBlank()) {
      throw new ConfigException(
              "<%s> element is missing required attribute '%s'".formatted(node.getTagName(), name))
          .withContext("tag", node.getTagName())
          .withContext("attribute", name);
    }
    return value;
  }

  /**
   * Boolean attribute. Accepts {@code 1/0}, {@code true/false}, {@code yes/no} and {@code on/off},
   * case-insensitively.
   */
  public static boolean bool(Element node, String name, boolean defaultValue) {
    String value = attr(node, name);
    if (value == null || value.isBlank()) return defaultValue;
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "1", "true", "yes", "on" -> true;
      case "0", "false", "no", "off" -> false;
      default -> throw new ConfigException(
              "<%s %s='%s'>: not a boolean value".formatted(node.getTagName(), name, value))
          .withContext("tag", node.getTagName())
          .withContext("attribute", name);
    };
  }

  /** Direct child elements, optionally restricted to one tag name ({@code null} for all). */
  public static List<Element> children(Element node, String tagName) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = node.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node child = nodes.item(i);
      if (child.getNodeType() == Node.ELEMENT_NODE
          && (tagName == null || tagName.equals(((Element) child).getTagName()))) {
        result.add((Element) child);
      }
    }
    return result;
  }

  /** Trimmed text content of the element, {@code null} when empty. */
  public static String text(Element node) {
    String text = node.getTextContent();
    if (text == null) return null;
    text = text.trim();
    return text.isEmpty() ? null : text;
  }
}
