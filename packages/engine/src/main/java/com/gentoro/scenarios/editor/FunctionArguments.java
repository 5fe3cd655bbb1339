package com.gentoro.scenarios.editor;

import com.gentoro.scenarios.exception.ConfigException;
import java.util.List;
import java.util.Map;

/**
 * Literal arguments of a {@code <function>} action: positional values followed by keyword values.
 * Every value is a {@link String}, a {@link Long}, a {@link Double} or a {@link Boolean}.
 */
public record FunctionArguments(List<Object> positional, Map<String, Object> keywords) {

  public static final FunctionArguments EMPTY = new FunctionArguments(List.of(), Map.of());

  public FunctionArguments {
    positional = List.copyOf(positional);
    keywords = Map.copyOf(keywords);
  }

  public int size() {
    return positional.size() + keywords.size();
  }

  /**
   * Argument given either by keyword or at {@code index}.
   *
   * @throws ConfigException if the argument is missing
   */
  public Object get(int index, String keyword) {
    if (keyword != null && keywords.containsKey(keyword)) {
      return keywords.get(keyword);
    }
    if (index >= 0 && index < positional.size()) {
      return positional.get(index);
    }
    throw new ConfigException(
        "Missing argument '%s' (position %d)".formatted(keyword, index + 1));
  }

  public String getString(int index, String keyword) {
    return String.valueOf(get(index, keyword));
  }

  public long getLong(int index, String keyword) {
    Object value = get(index, keyword);
    if (value instanceof Long l) return l;
    if (value instanceof Double d && d == Math.rint(d)) return d.longValue();
    try {
      return Long.parseLong(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new ConfigException(
          "Argument '%s' must be an integer, got '%s'".formatted(keyword, value), e);
    }
  }
}
