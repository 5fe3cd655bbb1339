package com.gentoro.scenarios.setup;

import com.gentoro.scenarios.logging.LoggingService;
import com.gentoro.scenarios.setup.action.ActionRegistry;
import com.gentoro.scenarios.setup.xml.DomSetupDocumentLoader;
import com.gentoro.scenarios.setup.xml.SetupDocumentLoader;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * Parsed setup documents keyed by their normalized absolute path.
 *
 * <p>The cache is owned by whoever orchestrates a series of runs. Parsing the same path again
 * returns the same {@link ScenarioSetup} instance. Not thread-safe; concurrent runs need their
 * own cache.
 */
public class SetupDocumentCache {
  private static final Logger log = LoggingService.getLogger(SetupDocumentCache.class);

  private final SetupDocumentLoader loader;
  private final ActionRegistry registry;
  private final Map<Path, ScenarioSetup> documents = new HashMap<>();

  public SetupDocumentCache() {
    this(new DomSetupDocumentLoader(), ActionRegistry.defaults());
  }

  public SetupDocumentCache(SetupDocumentLoader loader, ActionRegistry registry) {
    this.loader = loader;
    this.registry = registry;
  }

  public ScenarioSetup parse(@NotNull Path file) {
    Path key = file.toAbsolutePath().normalize();
    ScenarioSetup cached = documents.get(key);
    if (cached != null) {
      log.debug("Found scenario file \"{}\" in cache", key);
      return cached;
    }
    ScenarioSetup setup = new ScenarioSetup(loader.load(key), registry);
    documents.put(key, setup);
    return setup;
  }

  public boolean contains(Path file) {
    return documents.containsKey(file.toAbsolutePath().normalize());
  }

  public void evict(Path file) {
    documents.remove(file.toAbsolutePath().normalize());
  }

  public void clear() {
    documents.clear();
  }

  public int size() {
    return documents.size();
  }
}
