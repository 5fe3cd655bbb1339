package com.gentoro.scenarios.setup.iterator;

import com.gentoro.scenarios.exception.ConfigException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;

/**
 * Integer or real-valued range iterator.
 *
 * <p>The upper bound is inclusive: generation starts at {@code min}, emits {@code format(current)}
 * and adds {@code step} until {@code current > max}. Real values are accumulated as {@link
 * BigDecimal} so that decimal steps land exactly on the bound.
 */
public class NumericIterator extends SetupIterator {

  private final BigDecimal min;
  private final BigDecimal max;
  private final BigDecimal step;
  private final String format;
  private final List<String> values;

  public NumericIterator(
      String name, IteratorType type, String min, String max, String step, String format) {
    super(name, type);
    if (!type.isNumeric()) {
      throw new IllegalArgumentException("NumericIterator requires int or float type");
    }
    if (isBlank(min) || isBlank(max)) {
      throw new ConfigException(
              "%s iterator '%s' must provide min and max attributes"
                  .formatted(type.xmlName(), name))
          .withContext("iterator", name);
    }
    this.min = parse(name, type, "min", min);
    this.max = parse(name, type, "max", max);
    this.step = isBlank(step) ? BigDecimal.ONE : parse(name, type, "step", step);
    if (this.step.signum() <= 0) {
      throw new ConfigException("Iterator '%s': step must be positive".formatted(name))
          .withContext("iterator", name);
    }
    this.format = isBlank(format) ? type.defaultFormat() : format;
    this.values = Collections.unmodifiableList(generate());
  }

  private List<String> generate() {
    List<String> result = new ArrayList<>();
    for (BigDecimal current = min; current.compareTo(max) <= 0; current = current.add(step)) {
      result.add(formatValue(current));
    }
    if (result.isEmpty()) {
      throw new ConfigException(
              "Iterator '%s' produces no values (min %s > max %s)".formatted(name(), min, max))
          .withContext("iterator", name());
    }
    return result;
  }

  private String formatValue(BigDecimal value) {
    Object primary = type() == IteratorType.INT ? (Object) value.longValueExact() : value;
    try {
      return String.format(Locale.ROOT, format, primary);
    } catch (IllegalFormatException e) {
      // %d on a real truncates and %f on an integer widens, as printf-style templates expect
      Object fallback = type() == IteratorType.INT ? value : (Object) value.longValue();
      try {
        return String.format(Locale.ROOT, format, fallback);
      } catch (IllegalFormatException retry) {
        throw new ConfigException(
                "Iterator '%s': invalid format '%s'".formatted(name(), format), retry)
            .withContext("iterator", name());
      }
    }
  }

  private static BigDecimal parse(String name, IteratorType type, String attribute, String text) {
    try {
      BigDecimal value = new BigDecimal(text.trim());
      if (type == IteratorType.INT && value.stripTrailingZeros().scale() > 0) {
        throw new NumberFormatException("not an integer");
      }
      return value;
    } catch (NumberFormatException e) {
      throw new ConfigException(
              "Iterator '%s': %s value '%s' is not a valid %s"
                  .formatted(name, attribute, text, type.xmlName()),
              e)
          .withContext("iterator", name);
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public String format() {
    return format;
  }

  @Override
  public List<String> values() {
    return values;
  }

  @Override
  public String toString() {
    return "<iterator name='%s' type='%s' min='%s' max='%s' step='%s'/>"
        .formatted(name(), type().xmlName(), min, max, step);
  }
}
