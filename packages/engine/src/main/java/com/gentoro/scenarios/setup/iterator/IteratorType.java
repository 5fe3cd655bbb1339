package com.gentoro.scenarios.setup.iterator;

import java.util.Locale;

/** Value type declared by the {@code type} attribute of an {@code <iterator>}. */
public enum IteratorType {
  INT("%d"),
  FLOAT("%.1f"),
  LIST(null);

  private final String defaultFormat;

  IteratorType(String defaultFormat) {
    this.defaultFormat = defaultFormat;
  }

  public String defaultFormat() {
    return defaultFormat;
  }

  public boolean isNumeric() {
    return this != LIST;
  }

  public String xmlName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Resolve the XML type name, or {@code null} when it is not one of int, float or list. */
  public static IteratorType fromXml(String value) {
    if (value == null) return null;
    for (IteratorType type : values()) {
      if (type.xmlName().equals(value.trim())) return type;
    }
    return null;
  }
}
