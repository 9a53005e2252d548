package ca.gc.cra.rackd.domain.discovery;

import java.util.Locale;

/**
 * Port set policy for the port prober.
 *
 * <p>{@link #FULL} is resolved to the common port list; exhaustive sweeps are not performed.</p>
 *
 * @since 0.1.0
 */
public enum PortScanType {
  /** Curated list of well-known ports. */
  COMMON("common"),
  /** Requested full sweep, downgraded to the common list. */
  FULL("full"),
  /** Ports listed in the rule; an empty list falls back to the common list. */
  CUSTOM("custom");

  private final String wireName;

  PortScanType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lower-case name used in configuration.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Parses a configuration value, case-insensitively.
   *
   * @param raw textual port scan type
   * @return matching policy
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static PortScanType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("portScanType must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (PortScanType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("portScanType must be common, full or custom (was " + raw + ")");
  }
}
