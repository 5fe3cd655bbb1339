package com.gentoro.scenarios.setup.iterator;

import com.gentoro.scenarios.exception.ConfigException;
import java.util.Arrays;
import java.util.List;

/** Iterator over an explicit comma-separated list of literal strings. */
public class ValueListIterator extends SetupIterator {

  private final List<String> values;

  public ValueListIterator(String name, String valuesText) {
    super(name, IteratorType.LIST);
    if (valuesText == null || valuesText.isBlank()) {
      throw new ConfigException(
              "list iterator '%s' must provide a values attribute".formatted(name))
          .withContext("iterator", name);
    }
    this.values = Arrays.stream(valuesText.split(",")).map(String::trim).toList();
  }

  @Override
  public List<String> values() {
    return values;
  }

  @Override
  public String toString() {
    return "<iterator name='%s' type='list' values='%s'/>"
        .formatted(name(), String.join(",", values));
  }
}
