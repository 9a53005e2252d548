package ca.gc.cra.rackd.infrastructure.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rackd.application.util.CancellationToken;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ArpTableMacResolverTest {
  private static final List<String> TABLE = List.of(
      "IP address       HW type     Flags       HW address            Mask     Device",
      "10.0.0.10        0x1         0x2         52:54:00:AB:CD:EF     *        eth0",
      "10.0.0.1         0x1         0x2         00:1a:2b:3c:4d:5e     *        eth0",
      "10.0.0.20        0x1         0x0         00:00:00:00:00:00     *        eth0");

  @TempDir Path tempDir;

  @Test
  void readsMacForExactAddress() throws Exception {
    Path table = tempDir.resolve("arp");
    Files.write(table, TABLE);
    ArpTableMacResolver resolver = new ArpTableMacResolver(table, false);

    assertEquals(Optional.of("00:1a:2b:3c:4d:5e"), resolver.resolve("10.0.0.1", CancellationToken.create()));
    assertEquals(Optional.of("52:54:00:ab:cd:ef"), resolver.resolve("10.0.0.10", CancellationToken.create()));
  }

  @Test
  void incompleteAndMissingEntriesResolveToEmpty() throws Exception {
    Path table = tempDir.resolve("arp");
    Files.write(table, TABLE);
    ArpTableMacResolver resolver = new ArpTableMacResolver(table, false);

    assertTrue(resolver.resolve("10.0.0.20", CancellationToken.create()).isEmpty());
    assertTrue(resolver.resolve("10.0.0.99", CancellationToken.create()).isEmpty());
  }

  @Test
  void missingTableWithoutFallbackResolvesToEmpty() {
    ArpTableMacResolver resolver = new ArpTableMacResolver(tempDir.resolve("absent"), false);

    assertTrue(resolver.resolve("10.0.0.1", CancellationToken.create()).isEmpty());
  }

  @Test
  void normalizePadsAndLowercasesOctets() {
    assertEquals(Optional.of("0a:0b:0c:dd:ee:ff"), ArpTableMacResolver.normalize("A-B-C-DD-EE-FF"));
    assertEquals(Optional.of("00:1a:2b:3c:4d:5e"),
        ArpTableMacResolver.normalize("  10.0.0.1  00-1A-2B-3C-4D-5E  dynamic"));
    assertTrue(ArpTableMacResolver.normalize("(incomplete)").isEmpty());
    assertTrue(ArpTableMacResolver.normalize(null).isEmpty());
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void commandFallbackParsesArpOutput() throws Exception {
    Path arp = Files.writeString(tempDir.resolve("arp.sh"),
        "echo \"? ($1) at aa:bb:cc:dd:ee:ff [ether] on eth0\"\n");
    ArpTableMacResolver resolver = new ArpTableMacResolver(
        tempDir.resolve("absent"), List.of("/bin/sh", arp.toString()), Duration.ofSeconds(5));

    assertEquals(Optional.of("aa:bb:cc:dd:ee:ff"), resolver.resolve("10.0.0.5", CancellationToken.create()));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void hungArpCommandIsKilledAtTimeout() throws Exception {
    Path arp = Files.writeString(tempDir.resolve("arp.sh"),
        "sleep 8\necho \"? ($1) at aa:bb:cc:dd:ee:ff [ether] on eth0\"\n");
    ArpTableMacResolver resolver = new ArpTableMacResolver(
        tempDir.resolve("absent"), List.of("/bin/sh", arp.toString()), Duration.ofMillis(500));

    long start = System.nanoTime();
    Optional<String> mac = resolver.resolve("10.0.0.5", CancellationToken.create());
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(mac.isEmpty());
    assertTrue(elapsedMillis < 4_000, "arp lookup took " + elapsedMillis + " ms");
  }

  @Test
  void commandOutputSkipsLinesForOtherHosts() {
    List<String> output = List.of(
        "? (10.0.0.50) at 11:22:33:44:55:66 [ether] on eth0",
        "? (10.0.0.5) at 52:54:00:ab:cd:ef [ether] on eth0");

    assertEquals(Optional.of("52:54:00:ab:cd:ef"), ArpTableMacResolver.lookupCommandOutput(output, "10.0.0.5"));
  }
}
