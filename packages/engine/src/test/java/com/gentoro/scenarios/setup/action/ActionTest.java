package com.gentoro.scenarios.setup.action;

import static com.gentoro.scenarios.setup.SetupFixtures.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.editor.RecordingConfigEditor;
import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.setup.template.TemplateContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ActionTest {

  private final ActionRegistry registry = ActionRegistry.defaults();
  private TemplateContext context;
  private RecordingConfigEditor editor;

  @BeforeEach
  void setUp() {
    context = new TemplateContext();
    editor = new RecordingConfigEditor("grp", "base");
  }

  private Action action(String xml) {
    Action action = registry.create(element(xml));
    action.formatContent(context.asMap());
    return action;
  }

  private void runBothPhases(Action action) {
    action.run(editor, Map.of(), SetupPhase.STATIC);
    action.run(editor, Map.of(), SetupPhase.DYNAMIC);
  }

  @Test
  @DisplayName("formatting is cached and a second pass does not substitute again")
  void formattingIsIdempotent() {
    context.bind("x", "1");
    Action action = registry.create(element("<add name='n-{x}'>{x}-{{y}}</add>"));
    assertFalse(action.isFormatted());

    action.formatContent(context.asMap());
    assertTrue(action.isFormatted());
    assertEquals("1-{y}", action.content());

    action.formatContent(context.asMap());
    assertEquals("1-{y}", action.content());
    assertEquals("{x}-{{y}}", action.rawContent());
    assertEquals("n-1", ((ConfigAction) action).name());
  }

  @Test
  @DisplayName("static actions only run in the static pass and dynamic ones in the dynamic pass")
  void phaseIsolation() {
    Action staticAdd = action("<add name='a'>a.xml</add>");
    Action dynamicAdd = action("<add name='b' dynamic='1'>b.xml</add>");

    staticAdd.run(editor, Map.of(), SetupPhase.STATIC);
    dynamicAdd.run(editor, Map.of(), SetupPhase.STATIC);
    assertEquals(List.of("add(a,a.xml)"), editor.calls());

    editor.calls().clear();
    staticAdd.run(editor, Map.of(), SetupPhase.DYNAMIC);
    dynamicAdd.run(editor, Map.of(), SetupPhase.DYNAMIC);
    assertEquals(List.of("add(b,b.xml)"), editor.calls());
  }

  @Test
  @DisplayName("each mutation tag maps to its editor call")
  void mutationDispatch() {
    runBothPhases(action("<insert name='i' after='a'>i.xml</insert>"));
    runBothPhases(action("<replace name='r'>r.xml</replace>"));
    runBothPhases(action("<delete name='d'/>"));

    assertEquals(List.of("insert(i,i.xml,a)", "update(r,r.xml)", "delete(d)"), editor.calls());
  }

  @Test
  @DisplayName("directory placeholders are filled in at run time without changing the action")
  void directoriesResolvedAtRunTime() {
    Action add = action("<add name='p'>{scenarioDir}/p.xml</add>");
    assertEquals("{scenarioDir}/p.xml", add.content());

    add.run(editor, Map.of("scenarioDir", "out/s1", "baselineDir", "out/base"), SetupPhase.STATIC);

    assertEquals(List.of("add(p,out/s1/p.xml)"), editor.calls());
    assertEquals("{scenarioDir}/p.xml", add.content());
  }

  @Test
  @DisplayName("replace is delivered to the editor as an update")
  void replaceUsesUpdate() {
    ConfigEditor mocked = mock(ConfigEditor.class);
    Action replace = action("<replace name='solver'>solver.xml</replace>");

    replace.run(mocked, Map.of(), SetupPhase.DYNAMIC);
    verifyNoInteractions(mocked);

    replace.run(mocked, Map.of(), SetupPhase.STATIC);
    verify(mocked).updateScenarioComponent("solver", "solver.xml");
    verifyNoMoreInteractions(mocked);
  }

  @Test
  @DisplayName("if runs its children only when membership equals matches")
  void conditionalSemantics() {
    context.bind("region", "EU");
    IfAction in = (IfAction) action("<if value1='{region}' value2='USA, EU'><add name='a'/></if>");
    IfAction notIn =
        (IfAction)
            action("<if value1='{region}' value2='USA, EU' matches='0'><add name='b'/></if>");
    IfAction absent = (IfAction) action("<if value1='CN' value2='USA,EU'><add name='c'/></if>");

    assertTrue(in.isSatisfied());
    assertFalse(notIn.isSatisfied());
    assertFalse(absent.isSatisfied());

    runBothPhases(in);
    runBothPhases(notIn);
    runBothPhases(absent);
    assertEquals(List.of("add(a,null)"), editor.calls());
  }

  @Test
  @DisplayName("if is evaluated in both passes and its children stay phase filtered")
  void conditionalInBothPhases() {
    Action conditional =
        action(
            "<if value1='x' value2='x'>"
                + "<add name='s'>s.xml</add>"
                + "<add name='d' dynamic='1'>d.xml</add>"
                + "</if>");

    conditional.run(editor, Map.of(), SetupPhase.STATIC);
    assertEquals(List.of("add(s,s.xml)"), editor.calls());

    editor.calls().clear();
    conditional.run(editor, Map.of(), SetupPhase.DYNAMIC);
    assertEquals(List.of("add(d,d.xml)"), editor.calls());
  }

  @Test
  @DisplayName("function invokes the named capability with literal arguments")
  void functionInvokesCapability() {
    context.bind("region", "EU");
    Action function = action("<function name='record'>'{region}', 2, flag=True</function>");

    function.run(editor, Map.of(), SetupPhase.STATIC);

    assertEquals(List.of("record[EU, 2]{flag=true}"), editor.calls());
  }

  @Test
  @DisplayName("unknown capability is a configuration error raised at run time")
  void unknownCapability() {
    Action function = action("<function name='nope'>1</function>");

    ConfigException ex =
        assertThrows(
            ConfigException.class, () -> function.run(editor, Map.of(), SetupPhase.STATIC));
    assertEquals(
        "<function name='nope'>: function doesn't exist or is not callable from XML",
        ex.getMessage());
    function.run(editor, Map.of(), SetupPhase.DYNAMIC);
  }

  @Test
  @DisplayName("unparsable function arguments are rejected when the action is formatted")
  void unparsableArguments() {
    Action function = registry.create(element("<function name='x' dynamic='1'>foo(1</function>"));

    ConfigException ex =
        assertThrows(ConfigException.class, () -> function.formatContent(context.asMap()));
    assertEquals("x", ex.getContext().get("function"));
  }

  @Test
  @DisplayName("function arguments may carry directory placeholders inside strings")
  void functionDirectoryArguments() {
    Action function = action("<function name='record'>'{scenarioDir}/values.xml'</function>");

    function.run(editor, Map.of("scenarioDir", "out/s1"), SetupPhase.STATIC);

    assertEquals(List.of("record[out/s1/values.xml]{}"), editor.calls());
  }

  @Test
  @DisplayName("functions inside a conditional are checked whether or not it holds")
  void conditionalFunctionChecked() {
    Action conditional =
        registry.create(
            element("<if value1='a' value2='b'><function name='record'>1 2</function></if>"));

    assertThrows(ConfigException.class, () -> conditional.formatContent(context.asMap()));
  }

  @Test
  @DisplayName("malformed action elements are rejected when built")
  void malformedElements() {
    ConfigException unknown =
        assertThrows(ConfigException.class, () -> registry.create(element("<copy name='x'/>")));
    assertEquals("copy", unknown.getContext().get("tag"));

    assertThrows(ConfigException.class, () -> registry.create(element("<add>x</add>")));
    assertThrows(ConfigException.class, () -> registry.create(element("<insert name='x'/>")));
    assertThrows(
        ConfigException.class, () -> registry.create(element("<add name='x' dynamic='maybe'/>")));
    assertThrows(ConfigException.class, () -> registry.create(element("<if value1='a'/>")));
    assertThrows(
        ConfigException.class,
        () -> registry.create(element("<if value1='a' value2='a'><bogus/></if>")));
  }

  @Test
  @DisplayName("custom tags can be registered")
  void customTag() {
    registry.register("append", (node, r) -> new AddAction(node));
    assertInstanceOf(AddAction.class, registry.create(element("<append name='x'>y</append>")));
    assertTrue(registry.tags().contains("append"));
  }
}
