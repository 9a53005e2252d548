package ca.gc.cra.rackd.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void requireCidrAcceptsIpv4AndIpv6() {
    assertEquals("192.168.1.0/24", Net.requireCidr("subnet", " 192.168.1.0/24 "));
    assertEquals("fd00::/120", Net.requireCidr("subnet", "fd00::/120"));
  }

  @Test
  void requireCidrPrefixesKeyOnFailure() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Net.requireCidr("subnet", "192.168.1.0"));
    assertTrue(ex.getMessage().startsWith("subnet "));
  }

  @Test
  void addressOrCidrRecognizesBothForms() {
    assertTrue(Net.isAddressOrCidr("10.0.0.5"));
    assertTrue(Net.isAddressOrCidr("10.0.0.0/8"));
    assertTrue(Net.isAddressOrCidr("::1"));
    assertFalse(Net.isAddressOrCidr("10.0.0.0/33"));
    assertFalse(Net.isAddressOrCidr("printer.lab"));
    assertFalse(Net.isAddressOrCidr(" "));
  }

  @Test
  void hostnameChecksEachLabel() {
    assertTrue(Net.isHostname("printer.lab"));
    assertTrue(Net.isHostname("nas-01.example.com."));
    assertFalse(Net.isHostname("-nas.lab"));
    assertFalse(Net.isHostname("nas..lab"));
    assertFalse(Net.isHostname("bad_host"));
    assertFalse(Net.isHostname("a".repeat(64) + ".lab"));
    assertFalse(Net.isHostname(null));
  }
}
