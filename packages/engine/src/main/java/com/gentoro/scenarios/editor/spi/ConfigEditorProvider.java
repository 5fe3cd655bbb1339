package com.gentoro.scenarios.editor.spi;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.editor.EditorTarget;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable configuration editors.
 *
 * <p>Implementations register using ServiceLoader by adding their fully qualified class name to:
 * META-INF/services/com.gentoro.scenarios.editor.spi.ConfigEditorProvider
 */
public interface ConfigEditorProvider {
  /** Unique editor id used in configuration ({@code setup.editor}), e.g. "in-memory". */
  String id();

  /** Whether the provider can operate in the current runtime. */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  /**
   * Create an editor for {@code target}.
   *
   * @param parent editor of the scenario to inherit from, or {@code null}
   */
  ConfigEditor create(EditorTarget target, ConfigEditor parent, Configuration configuration);

  /**
   * Editor of a baseline that another scenario inherits from. Providers that keep the state of
   * earlier runs return the existing editor; the default creates a fresh one.
   */
  default ConfigEditor resolveParent(EditorTarget baseline, Configuration configuration) {
    return create(baseline, null, configuration);
  }

  /** Forget any editor kept for {@code target}; a no-op for providers that keep none. */
  default void release(EditorTarget target) {}

  /** Forget every editor kept by this provider. */
  default void clear() {}
}
