package com.gentoro.scenarios.setup.action;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gentoro.scenarios.editor.FunctionArguments;
import com.gentoro.scenarios.exception.ConfigException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FunctionArgumentParserTest {

  @Test
  @DisplayName("blank text has no arguments")
  void blank() {
    assertSame(FunctionArguments.EMPTY, FunctionArgumentParser.parse(null));
    assertSame(FunctionArguments.EMPTY, FunctionArgumentParser.parse("   "));
  }

  @Test
  @DisplayName("positional literals keep their types")
  void positionalLiterals() {
    FunctionArguments args =
        FunctionArgumentParser.parse("'Strings', \"market\", 2050, -1.5, True, false");
    assertEquals(List.of("Strings", "market", 2050L, -1.5d, true, false), args.positional());
    assertEquals(Map.of(), args.keywords());
  }

  @Test
  @DisplayName("keyword arguments follow positional ones")
  void keywordArguments() {
    FunctionArguments args = FunctionArgumentParser.parse("2050, name = 'x', flag=true");
    assertEquals(List.of(2050L), args.positional());
    assertEquals(Map.of("name", "x", "flag", true), args.keywords());
    assertEquals("x", args.getString(1, "name"));
    assertEquals(2050L, args.getLong(0, "year"));
  }

  @Test
  @DisplayName("escapes inside quoted strings are decoded")
  void escapes() {
    FunctionArguments args = FunctionArgumentParser.parse("'it\\'s', 'a,b', \"tab\\there\"");
    assertEquals(List.of("it's", "a,b", "tab\there"), args.positional());
  }

  @Test
  @DisplayName("anything but literals is rejected")
  void rejectsNonLiterals() {
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("os.system('x')"));
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("someName"));
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("0x1F"));
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("'unterminated"));
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("1 2"));
  }

  @Test
  @DisplayName("numbers follow plain decimal literal syntax")
  void numberSyntax() {
    assertEquals(
        List.of(0L, 0L, 5L, 1.0d, 0.5d, 1000.0d, 7.5d),
        FunctionArgumentParser.parse("0, -0, +5, 1., .5, 1e3, 07.5").positional());

    for (String text : List.of("07", "-007", "1f", "1d", "1e3D", "10L", "0b1", "NaN", "1e")) {
      assertThrows(
          ConfigException.class, () -> FunctionArgumentParser.parse(text), "accepted " + text);
    }
  }

  @Test
  @DisplayName("keyword misuse is rejected")
  void keywordMisuse() {
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("a=1, 2"));
    assertThrows(ConfigException.class, () -> FunctionArgumentParser.parse("a=1, a=2"));
  }

  @Test
  @DisplayName("missing arguments are reported by name")
  void missingArgument() {
    FunctionArguments args = FunctionArgumentParser.parse("'only'");
    ConfigException ex = assertThrows(ConfigException.class, () -> args.get(1, "value"));
    assertEquals("Missing argument 'value' (position 2)", ex.getMessage());
  }
}
