package com.gentoro.scenarios.setup.action;

import com.gentoro.scenarios.editor.FunctionArguments;
import com.gentoro.scenarios.exception.ConfigException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Parses the text of a {@code <function>} action into literal arguments.
 *
 * <p>Accepted syntax is a comma-separated list of literals, optionally followed by {@code
 * keyword=literal} pairs. Literals are single- or double-quoted strings (with backslash escapes),
 * integers, reals and the booleans {@code true}/{@code false} (also {@code True}/{@code False}).
 * Nothing else is evaluated. Integers may not have leading zeros and numbers take no type
 * suffixes or radix prefixes.
 */
public final class FunctionArgumentParser {
  private static final Pattern DIGITS = Pattern.compile("[+-]?\\d+");
  private static final Pattern INTEGER = Pattern.compile("[+-]?(0|[1-9]\\d*)");
  private static final Pattern REAL =
      Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

  private final String text;
  private int pos;

  private FunctionArgumentParser(String text) {
    this.text = text;
  }

  /**
   * @param text argument text, {@code null} or blank for no arguments
   * @throws ConfigException if the text is not a literal argument list
   */
  public static FunctionArguments parse(String text) {
    if (text == null || text.isBlank()) return FunctionArguments.EMPTY;
    return new FunctionArgumentParser(text).arguments();
  }

  private FunctionArguments arguments() {
    List<Object> positional = new ArrayList<>();
    Map<String, Object> keywords = new LinkedHashMap<>();

    skipWhitespace();
    while (pos < text.length()) {
      String keyword = keyword();
      if (keyword != null) {
        if (keywords.containsKey(keyword)) {
          throw error("duplicate keyword argument '" + keyword + "'");
        }
        keywords.put(keyword, literal());
      } else {
        if (!keywords.isEmpty()) {
          throw error("positional argument follows keyword argument");
        }
        positional.add(literal());
      }
      skipWhitespace();
      if (pos >= text.length()) break;
      if (text.charAt(pos) != ',') {
        throw error("expected ','");
      }
      pos++;
      skipWhitespace();
    }
    return new FunctionArguments(positional, keywords);
  }

  /** Consume {@code identifier =} if present, otherwise leave the position untouched. */
  private String keyword() {
    int start = pos;
    if (start >= text.length() || !Character.isJavaIdentifierStart(text.charAt(start))) {
      return null;
    }
    int end = start + 1;
    while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) end++;
    int eq = end;
    while (eq < text.length() && Character.isWhitespace(text.charAt(eq))) eq++;
    if (eq < text.length() && text.charAt(eq) == '=') {
      pos = eq + 1;
      skipWhitespace();
      return text.substring(start, end);
    }
    return null;
  }

  private Object literal() {
    if (pos >= text.length()) throw error("missing value");
    char c = text.charAt(pos);
    if (c == '\'' || c == '"') return string(c);

    int start = pos;
    while (pos < text.length()
        && text.charAt(pos) != ','
        && !Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
    String token = text.substring(start, pos);
    switch (token) {
      case "true", "True":
        return Boolean.TRUE;
      case "false", "False":
        return Boolean.FALSE;
      default:
        break;
    }
    if (DIGITS.matcher(token).matches()) {
      if (!INTEGER.matcher(token).matches()) {
        throw error("leading zeros in integer '" + token + "'");
      }
      try {
        return Long.parseLong(token);
      } catch (NumberFormatException e) {
        throw error("integer out of range '" + token + "'");
      }
    }
    if (REAL.matcher(token).matches()) {
      return NumberUtils.createDouble(token.startsWith("+") ? token.substring(1) : token);
    }
    pos = start;
    throw error("not a literal '" + token + "'");
  }

  private String string(char quote) {
    StringBuilder sb = new StringBuilder();
    pos++;
    while (pos < text.length()) {
      char c = text.charAt(pos++);
      if (c == quote) return sb.toString();
      if (c == '\\') {
        if (pos >= text.length()) break;
        char escaped = text.charAt(pos++);
        switch (escaped) {
          case 'n' -> sb.append('\n');
          case 't' -> sb.append('\t');
          case 'r' -> sb.append('\r');
          default -> sb.append(escaped);
        }
      } else {
        sb.append(c);
      }
    }
    throw error("unterminated string");
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
  }

  private ConfigException error(String problem) {
    return new ConfigException(
        "Cannot parse function arguments \"%s\" at offset %d: %s".formatted(text, pos, problem));
  }
}
