package com.gentoro.scenarios.editor;

import com.gentoro.scenarios.editor.providers.InMemoryConfigEditorProvider;
import com.gentoro.scenarios.editor.spi.ConfigEditorProvider;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.logging.LoggingService;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Creates {@link ConfigEditor} instances through the provider selected by the {@code
 * setup.editor} configuration key (default {@value InMemoryConfigEditorProvider#ID}).
 *
 * <p>Providers are discovered with {@link ServiceLoader}; additional ones can be registered
 * programmatically and replace discovered providers with the same id.
 */
public class ConfigEditorFactory {
  private static final Logger log = LoggingService.getLogger(ConfigEditorFactory.class);

  public static final String EDITOR_KEY = "setup.editor";

  private final Configuration configuration;
  private final Map<String, ConfigEditorProvider> providers = new LinkedHashMap<>();

  public ConfigEditorFactory(Configuration configuration) {
    this.configuration = configuration;
    for (ConfigEditorProvider provider : ServiceLoader.load(ConfigEditorProvider.class)) {
      providers.put(provider.id(), provider);
    }
    providers.putIfAbsent(InMemoryConfigEditorProvider.ID, new InMemoryConfigEditorProvider());
    log.trace("Discovered config editor providers: {}", providers.keySet());
  }

  public ConfigEditorFactory register(ConfigEditorProvider provider) {
    providers.put(provider.id(), provider);
    return this;
  }

  public Set<String> providerIds() {
    return Collections.unmodifiableSet(providers.keySet());
  }

  /** The provider named by {@code setup.editor}. */
  public ConfigEditorProvider provider() {
    String id = configuration.getString(EDITOR_KEY, InMemoryConfigEditorProvider.ID).trim();
    ConfigEditorProvider provider = providers.get(id);
    if (provider == null) {
      throw new ConfigException(
              "Unknown config editor '%s'; available: %s".formatted(id, providers.keySet()))
          .withContext(EDITOR_KEY, id);
    }
    if (!provider.isAvailable(configuration)) {
      throw new ConfigException("Config editor '%s' is not available".formatted(id))
          .withContext(EDITOR_KEY, id);
    }
    return provider;
  }

  public ConfigEditor create(EditorTarget target, ConfigEditor parent) {
    ConfigEditorProvider provider = provider();
    log.debug(
        "Creating '{}' editor for {}/{}{}",
        provider.id(),
        target.groupName(),
        target.scenarioName(),
        parent == null ? "" : " (parent " + parent.target().scenarioName() + ")");
    return provider.create(target, parent, configuration);
  }

  /** Editor of the baseline {@code target} for use as a parent. */
  public ConfigEditor resolveParent(EditorTarget target) {
    ConfigEditorProvider provider = provider();
    log.debug("Resolving parent editor {}/{}", target.groupName(), target.scenarioName());
    return provider.resolveParent(target, configuration);
  }

  /** Let every provider forget the editor kept for {@code target}. */
  public void release(EditorTarget target) {
    providers.values().forEach(provider -> provider.release(target));
  }

  /** Let every provider forget all editors it keeps. */
  public void clear() {
    providers.values().forEach(ConfigEditorProvider::clear);
  }
}
