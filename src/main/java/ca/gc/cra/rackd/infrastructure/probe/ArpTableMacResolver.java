package ca.gc.cra.rackd.infrastructure.probe;

import ca.gc.cra.rackd.application.port.MacAddressResolver;
import ca.gc.cra.rackd.application.util.CancellationToken;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a host's hardware address from the local neighbour table.
 * <p><strong>Why:</strong> A MAC raises device confidence and survives address changes; the kernel's table is
 * populated by the connects earlier stages already made.</p>
 * <p><strong>How:</strong> Reads {@code /proc/net/arp} when it exists; otherwise runs {@code arp -n <ip>} (or
 * {@code arp -a <ip>} on Windows) and scans its output. Incomplete entries ({@code 00:00:00:00:00:00}) are
 * unresolved. Results are lower-case and colon separated.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each call reads the table afresh.</p>
 *
 * @since 0.1.0
 */
public final class ArpTableMacResolver implements MacAddressResolver {
  private static final Logger log = LoggerFactory.getLogger(ArpTableMacResolver.class);
  private static final Path PROC_ARP = Path.of("/proc/net/arp");
  private static final Pattern MAC =
      Pattern.compile("(?i)\\b([0-9a-f]{1,2})[:-]([0-9a-f]{1,2})[:-]([0-9a-f]{1,2})"
          + "[:-]([0-9a-f]{1,2})[:-]([0-9a-f]{1,2})[:-]([0-9a-f]{1,2})\\b");
  private static final String INCOMPLETE = "00:00:00:00:00:00";
  private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(2);

  private final Path arpTable;
  private final List<String> arpCommand;
  private final Duration commandTimeout;

  /** Creates a resolver reading the kernel table with the {@code arp} command as fallback. */
  public ArpTableMacResolver() {
    this(PROC_ARP, true);
  }

  /**
   * Creates a resolver over an explicit table file.
   *
   * @param arpTable file in {@code /proc/net/arp} layout
   * @param commandFallback whether to run {@code arp} when the file is missing
   */
  public ArpTableMacResolver(Path arpTable, boolean commandFallback) {
    this(arpTable, commandFallback ? platformArpCommand() : List.of(), COMMAND_TIMEOUT);
  }

  ArpTableMacResolver(Path arpTable, List<String> arpCommand, Duration commandTimeout) {
    this.arpTable = Objects.requireNonNull(arpTable, "arpTable");
    this.arpCommand = List.copyOf(arpCommand);
    this.commandTimeout = Objects.requireNonNull(commandTimeout, "commandTimeout");
  }

  @Override
  public Optional<String> resolve(String ip, CancellationToken cancellation) {
    if (ip == null || cancellation.isCancelled()) {
      return Optional.empty();
    }
    if (Files.isReadable(arpTable)) {
      try {
        return lookupTable(Files.readAllLines(arpTable, StandardCharsets.US_ASCII), ip);
      } catch (IOException ex) {
        log.debug("Unable to read {}: {}", arpTable, ex.getMessage());
        return Optional.empty();
      }
    }
    return arpCommand.isEmpty() ? Optional.empty() : lookupCommand(ip);
  }

  /**
   * Finds the entry for {@code ip} in {@code /proc/net/arp} lines.
   *
   * @param lines table lines including the header
   * @param ip address to find
   * @return normalized MAC when a complete entry exists
   */
  static Optional<String> lookupTable(List<String> lines, String ip) {
    for (String line : lines) {
      String[] columns = line.trim().split("\\s+");
      // IP address, HW type, Flags, HW address, Mask, Device
      if (columns.length >= 4 && columns[0].equals(ip)) {
        return normalize(columns[3]);
      }
    }
    return Optional.empty();
  }

  /**
   * Normalizes a MAC to lower-case colon form.
   *
   * @param raw MAC in colon or dash form, octets optionally unpadded
   * @return normalized MAC, empty when malformed or incomplete
   */
  static Optional<String> normalize(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    Matcher matcher = MAC.matcher(raw);
    if (!matcher.find()) {
      return Optional.empty();
    }
    StringBuilder mac = new StringBuilder(17);
    for (int group = 1; group <= 6; group++) {
      String octet = matcher.group(group).toLowerCase(Locale.ROOT);
      if (group > 1) {
        mac.append(':');
      }
      if (octet.length() == 1) {
        mac.append('0');
      }
      mac.append(octet);
    }
    String normalized = mac.toString();
    return INCOMPLETE.equals(normalized) ? Optional.empty() : Optional.of(normalized);
  }

  private static List<String> platformArpCommand() {
    boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    return List.of("arp", windows ? "-a" : "-n");
  }

  /** Runs the arp command with output sent to a temp file, so a hung command is killed at the timeout. */
  private Optional<String> lookupCommand(String ip) {
    List<String> argv = new ArrayList<>(arpCommand);
    argv.add(ip);
    Path output = null;
    Process process = null;
    try {
      output = Files.createTempFile("rackd-arp-", ".txt");
      process = new ProcessBuilder(argv)
          .redirectErrorStream(true)
          .redirectOutput(output.toFile())
          .start();
      if (!process.waitFor(commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.debug("arp lookup for {} exceeded {} ms", ip, commandTimeout.toMillis());
        return Optional.empty();
      }
      return lookupCommandOutput(Files.readAllLines(output, StandardCharsets.ISO_8859_1), ip);
    } catch (IOException ex) {
      log.debug("arp lookup for {} failed: {}", ip, ex.getMessage());
      return Optional.empty();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    } finally {
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      deleteQuietly(output);
    }
  }

  static Optional<String> lookupCommandOutput(List<String> lines, String ip) {
    Pattern address = Pattern.compile("(^|[^0-9a-fA-F.:])" + Pattern.quote(ip) + "($|[^0-9a-fA-F.:])");
    for (String line : lines) {
      Optional<String> mac = address.matcher(line).find() ? normalize(line) : Optional.empty();
      if (mac.isPresent()) {
        return mac;
      }
    }
    return Optional.empty();
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Unable to delete {}: {}", file, ex.getMessage());
    }
  }
}
