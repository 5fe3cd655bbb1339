package com.gentoro.scenarios.editor.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scenarios.editor.EditorTarget;
import com.gentoro.scenarios.editor.FunctionArguments;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.exception.ExecutionException;
import com.gentoro.scenarios.setup.action.FunctionArgumentParser;
import com.gentoro.scenarios.utility.JacksonUtility;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryConfigEditorTest {

  private InMemoryConfigEditor editor;

  @BeforeEach
  void setUp() {
    editor = new InMemoryConfigEditor(EditorTarget.baseline("ref", "base"));
  }

  private List<String> names(InMemoryConfigEditor e) {
    return e.components().stream().map(ScenarioComponent::name).toList();
  }

  @Test
  @DisplayName("components keep insertion order and inserts land after their anchor")
  void componentOrdering() {
    editor.addScenarioComponent("a", "a.xml");
    editor.addScenarioComponent("c", "c.xml");
    editor.insertScenarioComponent("b", "b.xml", "a");

    assertEquals(List.of("a", "b", "c"), names(editor));
    assertEquals(Optional.of("b.xml"), editor.component("b"));
  }

  @Test
  @DisplayName("update replaces content in place and delete removes the component")
  void updateAndDelete() {
    editor.addScenarioComponent("a", "a.xml");
    editor.addScenarioComponent("b", "b.xml");

    editor.updateScenarioComponent("a", "a2.xml");
    editor.deleteScenarioComponent("b");
    editor.deleteScenarioComponent("missing");

    assertEquals(List.of("a"), names(editor));
    assertEquals(Optional.of("a2.xml"), editor.component("a"));
  }

  @Test
  @DisplayName("duplicates and missing anchors are execution errors")
  void mutationErrors() {
    editor.addScenarioComponent("a", "a.xml");

    assertThrows(ExecutionException.class, () -> editor.addScenarioComponent("a", "x"));
    assertThrows(ExecutionException.class, () -> editor.insertScenarioComponent("a", "x", "a"));
    ExecutionException anchor =
        assertThrows(
            ExecutionException.class, () -> editor.insertScenarioComponent("n", "x", "zzz"));
    assertEquals("zzz", anchor.getContext().get("component"));
    assertThrows(ExecutionException.class, () -> editor.updateScenarioComponent("zzz", "x"));
  }

  @Test
  @DisplayName("a child editor starts from a copy of its parent")
  void inheritsParentState() {
    editor.addScenarioComponent("a", "a.xml");
    editor.setStopYear(2050);

    InMemoryConfigEditor child =
        new InMemoryConfigEditor(EditorTarget.scenario("ref", "base", "s1"), editor);
    child.addScenarioComponent("b", "b.xml");
    child.updateConfigComponent(InMemoryConfigEditor.INTS_SECTION, "stop-year", "2100");

    assertEquals(List.of("a", "b"), names(child));
    assertEquals(List.of("a"), names(editor));
    assertEquals(Optional.of("2050"), editor.configValue("Ints", "stop-year"));
    assertEquals(Optional.of("2100"), child.configValue("Ints", "stop-year"));
    assertTrue(child.parent().isPresent());
  }

  @Test
  @DisplayName("capabilities are reachable by name with positional or keyword arguments")
  void capabilities() {
    editor
        .capability("updateConfigComponent")
        .orElseThrow()
        .invoke(FunctionArgumentParser.parse("'Strings', 'market', value='EU'"));
    editor.capability("setStopYear").orElseThrow().invoke(FunctionArgumentParser.parse("2075"));

    assertEquals(Optional.of("EU"), editor.configValue("Strings", "market"));
    assertEquals(Optional.of("2075"), editor.configValue("Ints", "stop-year"));
    assertTrue(editor.capability("runModel").isEmpty());

    assertThrows(
        ConfigException.class,
        () -> editor.capability("setStopYear").orElseThrow().invoke(FunctionArguments.EMPTY));
    assertThrows(
        ConfigException.class,
        () ->
            editor
                .capability("setStopYear")
                .orElseThrow()
                .invoke(FunctionArgumentParser.parse("'soon'")));
  }

  @Test
  @DisplayName("state snapshot is rendered as JSON")
  void jsonSnapshot() throws Exception {
    editor.addScenarioComponent("a", "a.xml");
    editor.setStopYear(2050);

    JsonNode json = JacksonUtility.getJsonMapper().readTree(editor.toJson());

    assertEquals("ref", json.get("group").asText());
    assertEquals("base", json.get("scenario").asText());
    assertEquals("a.xml", json.get("components").get(0).get("content").asText());
    assertEquals("2050", json.get("config").get("Ints").get("stop-year").asText());
  }
}
