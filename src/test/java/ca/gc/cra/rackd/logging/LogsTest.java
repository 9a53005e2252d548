package ca.gc.cra.rackd.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    String value = "SSH-2.0-OpenSSH_8.9";
    assertSame(value, Logs.truncate(value, 64));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void truncateAppendsOriginalLength() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncateDropsSplitCodepoint() {
    String result = Logs.truncate("éé", 3);
    assertTrue(result.startsWith("é... (truncated, 3 of 4)"), result);
  }

  @Test
  void truncateRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void bannerNeutralizesLineBreaks() {
    assertEquals("220 ready??INFO forged", Logs.banner("220 ready\r\nINFO forged", 64));
    assertEquals("<null>", Logs.banner(null, 64));
  }
}
