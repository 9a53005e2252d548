package ca.gc.cra.rackd.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"subnet=10.0.0.0/24", "scanType=quick"});
    assertEquals("10.0.0.0/24", map.get("subnet"));
    assertEquals("quick", map.get("scanType"));
  }

  @Test
  void splitsOnFirstEqualsAndKeepsLastDuplicate() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"otelResourceAttributes=env=lab", "hostConcurrency=2", "hostConcurrency=4"});
    assertEquals("env=lab", map.get("otelResourceAttributes"));
    assertEquals("4", map.get("hostConcurrency"));
  }

  @Test
  void emptyValueIsAllowed() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"excludeIps="});
    assertEquals("", map.get("excludeIps"));
  }

  @Test
  void rejectsBareWords() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"subnet"}));
    assertEquals("argument must be key=value (was 'subnet')", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=10.0.0.0/24"}));
  }

  @Test
  void rejectsOddKeysAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"sub net=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"networkName=a\u0007b"}));
  }

  @Test
  void nullArgumentsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }
}
