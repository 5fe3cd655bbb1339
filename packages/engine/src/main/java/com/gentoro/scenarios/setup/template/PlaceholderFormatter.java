package com.gentoro.scenarios.setup.template;

import com.gentoro.scenarios.exception.ConfigException;
import java.util.Map;

/**
 * Substitutes {@code {name}} placeholders in setup text.
 *
 * <p>{@link #format(String, Map)} is strict: every placeholder must be bound, and doubled braces
 * produce literal braces. {@link #resolve(String, Map)} is lenient and only replaces the
 * placeholders whose names are in the map, which is how directories are filled into text that
 * was already expanded once.
 */
public final class PlaceholderFormatter {
  private PlaceholderFormatter() {}

  public static String format(String template, Map<String, String> values) {
    if (template == null) return null;
    StringBuilder out = new StringBuilder(template.length());
    int i = 0;
    int length = template.length();
    while (i < length) {
      char c = template.charAt(i);
      if (c == '{') {
        if (i + 1 < length && template.charAt(i + 1) == '{') {
          out.append('{');
          i += 2;
          continue;
        }
        int close = template.indexOf('}', i + 1);
        if (close < 0) {
          throw new ConfigException("Unclosed '{' in \"%s\"".formatted(template));
        }
        String key = template.substring(i + 1, close).trim();
        if (key.isEmpty() || key.indexOf('{') >= 0) {
          throw new ConfigException("Empty or malformed placeholder in \"%s\"".formatted(template));
        }
        String value = values.get(key);
        if (value == null) {
          throw new ConfigException(
                  "Placeholder '{%s}' in \"%s\" is not bound to any iterator"
                      .formatted(key, template))
              .withContext("placeholder", key);
        }
        out.append(value);
        i = close + 1;
      } else if (c == '}') {
        if (i + 1 < length && template.charAt(i + 1) == '}') {
          out.append('}');
          i += 2;
          continue;
        }
        throw new ConfigException("Single '}' encountered in \"%s\"".formatted(template));
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  public static String resolve(String text, Map<String, String> values) {
    if (text == null || values == null || values.isEmpty()) return text;
    String result = text;
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getValue() != null) {
        result = result.replace("{" + entry.getKey() + "}", entry.getValue());
      }
    }
    return result;
  }
}
