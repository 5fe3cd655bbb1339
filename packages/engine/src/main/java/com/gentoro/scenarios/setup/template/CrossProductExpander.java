package com.gentoro.scenarios.setup.template;

import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.iterator.SetupIterator;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Generalized nested loop over a list of iterators.
 *
 * <p>The first iterator is the outermost loop. Each level binds its current value into the shared
 * {@link TemplateContext}, and at the innermost level a fresh node is built and handed to the
 * expand callback. The callback runs before the loops advance, which is what allows it to format
 * names and content from the context in place.
 */
public class CrossProductExpander {
  private static final Logger log = LoggingService.getLogger(CrossProductExpander.class);

  private final TemplateContext context;
  private final Function<String, SetupIterator> iterators;

  /**
   * @param context context receiving the bound values
   * @param iterators lookup of iterators by name; expected to throw for unknown names
   */
  public CrossProductExpander(TemplateContext context, Function<String, SetupIterator> iterators) {
    this.context = context;
    this.iterators = iterators;
  }

  /** Split a comma-delimited {@code iterator} attribute into trimmed names. */
  public static List<String> iteratorNames(String iteratorAttribute) {
    if (iteratorAttribute == null || iteratorAttribute.isBlank()) return List.of();
    return Arrays.stream(iteratorAttribute.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  /**
   * Expand one template node.
   *
   * @param iteratorAttribute value of the node's {@code iterator} attribute, may be null
   * @param factory builds a fresh node instance from the template
   * @param expand receives each instance while the context holds its combination
   * @return number of instances produced
   */
  public <T> int expand(String iteratorAttribute, Supplier<T> factory, Consumer<T> expand) {
    List<String> names = iteratorNames(iteratorAttribute);
    if (names.isEmpty()) {
      expand.accept(factory.get());
      return 1;
    }
    log.trace("Expanding over iterators {}", names);
    return iterate(names, 0, factory, expand);
  }

  private <T> int iterate(List<String> names, int depth, Supplier<T> factory, Consumer<T> expand) {
    String name = names.get(depth);
    SetupIterator iterator = iterators.apply(name);
    int produced = 0;
    for (String value : iterator.values()) {
      context.bind(name, value);
      if (depth + 1 < names.size()) {
        produced += iterate(names, depth + 1, factory, expand);
      } else {
        expand.accept(factory.get());
        produced++;
      }
    }
    return produced;
  }
}
