package ca.gc.cra.rackd.domain.discovery;

import java.util.Locale;

/**
 * <strong>What:</strong> Depth of a discovery run.
 * <p><strong>Why:</strong> Quick scans trust ICMP alone; full and deep scans add port and service evidence.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ScanType {
  /** ICMP-only sweep; silent hosts are dropped. */
  QUICK("quick", 1),
  /** Reachability, identity, ports and services. */
  FULL("full", 3),
  /** Same probes as {@link #FULL}; recorded with a higher depth. */
  DEEP("deep", 5);

  /** Depth recorded when the scan type is not one of the known values. */
  public static final int DEFAULT_DEPTH = 2;

  private final String wireName;
  private final int depth;

  ScanType(String wireName, int depth) {
    this.wireName = wireName;
    this.depth = depth;
  }

  /**
   * Returns the lower-case name used in persisted records and configuration.
   *
   * @return wire name such as {@code "quick"}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Returns the numeric scan depth stored on the scan record.
   *
   * @return 1 for quick, 3 for full, 5 for deep
   */
  public int depth() {
    return depth;
  }

  /**
   * Parses a configuration value, case-insensitively.
   *
   * @param raw textual scan type
   * @return matching scan type
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static ScanType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("scanType must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ScanType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("scanType must be quick, full or deep (was " + raw + ")");
  }

  /**
   * Resolves the depth for a possibly absent scan type.
   *
   * @param type scan type or {@code null}
   * @return depth of {@code type}, or {@link #DEFAULT_DEPTH} when {@code null}
   */
  public static int depthOf(ScanType type) {
    return type == null ? DEFAULT_DEPTH : type.depth;
  }
}
