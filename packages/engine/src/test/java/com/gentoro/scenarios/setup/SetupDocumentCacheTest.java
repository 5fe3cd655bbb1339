package com.gentoro.scenarios.setup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.exception.ScenarioErrorCode;
import com.gentoro.scenarios.exception.ScenarioException;
import com.gentoro.scenarios.setup.action.ActionRegistry;
import com.gentoro.scenarios.setup.xml.DomSetupDocumentLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SetupDocumentCacheTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("the same path is parsed once and returns the same instance")
  void cachesByPath() throws Exception {
    Path file = tempDir.resolve("setup.xml");
    Files.writeString(file, "<setup><scenarioGroup name='g'/></setup>");

    AtomicInteger loads = new AtomicInteger();
    DomSetupDocumentLoader dom = new DomSetupDocumentLoader();
    SetupDocumentCache cache =
        new SetupDocumentCache(
            path -> {
              loads.incrementAndGet();
              return dom.load(path);
            },
            ActionRegistry.defaults());

    ScenarioSetup first = cache.parse(file);
    ScenarioSetup second = cache.parse(tempDir.resolve("x/../setup.xml"));

    assertSame(first, second);
    assertEquals(1, loads.get());
    assertTrue(cache.contains(file));
    assertEquals(1, cache.size());

    cache.evict(file);
    assertFalse(cache.contains(file));
    assertNotSame(first, cache.parse(file));
    assertEquals(2, loads.get());

    cache.clear();
    assertEquals(0, cache.size());
  }

  @Test
  @DisplayName("fixture documents load from the classpath")
  void loadsFixture() {
    ScenarioSetup setup =
        new SetupDocumentCache().parse(SetupFixtures.resource("setups/grouped.xml"));
    assertEquals("grouped", setup.name());
    assertEquals(2, setup.groups().size());
  }

  @Test
  @DisplayName("unreadable and malformed documents are rejected")
  void badDocuments() throws Exception {
    SetupDocumentCache cache = new SetupDocumentCache();
    ScenarioException missing =
        assertThrows(ScenarioException.class, () -> cache.parse(tempDir.resolve("missing.xml")));
    assertEquals(ScenarioErrorCode.IO_ERROR, missing.getCode());

    Path broken = tempDir.resolve("broken.xml");
    Files.writeString(broken, "<setup><scenarioGroup name='g'>");
    assertThrows(ConfigException.class, () -> cache.parse(broken));

    Path doctype = tempDir.resolve("doctype.xml");
    Files.writeString(doctype, "<!DOCTYPE setup [<!ENTITY x 'y'>]><setup/>");
    assertThrows(ConfigException.class, () -> cache.parse(doctype));
    assertEquals(0, cache.size());
  }
}
