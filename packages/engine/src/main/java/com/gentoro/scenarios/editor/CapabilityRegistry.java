package com.gentoro.scenarios.editor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of capabilities that {@code <function>} actions may invoke by name.
 *
 * <p>Typical lifecycle:
 *
 * <ol>
 *   <li>Create a registry.
 *   <li>Register the editor's capabilities.
 *   <li>Resolve them per editor instance with {@link #bind(String, ConfigEditor)}.
 * </ol>
 */
public class CapabilityRegistry<E extends ConfigEditor> {

  private final Map<String, CapabilityHandler<E>> handlers = new LinkedHashMap<>();

  /**
   * Register a capability.
   *
   * @param name name used by the {@code name} attribute of {@code <function>}
   * @param handler implementation
   * @return this registry for fluent usage
   */
  public CapabilityRegistry<E> register(String name, CapabilityHandler<E> handler) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Capability name must not be blank");
    }
    handlers.put(name, handler);
    return this;
  }

  /** Resolve {@code name} into a capability bound to {@code editor}. */
  public Optional<Capability> bind(String name, E editor) {
    CapabilityHandler<E> handler = name == null ? null : handlers.get(name);
    if (handler == null) return Optional.empty();
    return Optional.of(arguments -> handler.invoke(editor, arguments));
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(handlers.keySet());
  }
}
