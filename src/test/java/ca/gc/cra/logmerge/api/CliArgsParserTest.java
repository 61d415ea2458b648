package ca.gc.cra.logmerge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "in=/logs", "otelResourceAttributes=env=prod,team=ops", "  ", null});

    assertEquals("/logs", map.get("in"));
    assertEquals("env=prod,team=ops", map.get("otelResourceAttributes"));
    assertEquals(List.of("in", "otelResourceAttributes"), List.copyOf(map.keySet()));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1in=x"}));
  }

  @Test
  void rejectsRepeatedKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"in=a", "in=b"}));
    assertTrue(ex.getMessage().contains("more than once"));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesFlagsAndAliases() {
    CliInput input = CliInput.parse(new String[] {"-n", "--Allow-Overwrite", "-h", "in=/logs"});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.hasFlag("--allow-overwrite"));
    assertTrue(input.help());
    assertEquals(List.of("in=/logs"), List.of(input.keyValueArgs()));
  }
}
