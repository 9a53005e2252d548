package ca.gc.cra.rackd.domain.discovery;

import java.util.Objects;

/**
 * Service fingerprint for one open TCP port.
 *
 * @param port TCP port
 * @param protocol transport label, always {@code "tcp"}
 * @param banner first line returned by the service, trimmed; empty when nothing was read
 * @param service classified service name, {@code "unknown"} when neither banner nor port table matched
 * @param version version token extracted from the banner; may be empty
 * @since 0.1.0
 */
public record ServiceInfo(int port, String protocol, String banner, String service, String version) {
  /** Transport label recorded for every fingerprint. */
  public static final String TCP = "tcp";

  public ServiceInfo {
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535 (was " + port + ")");
    }
    protocol = Objects.requireNonNullElse(protocol, TCP);
    banner = Objects.requireNonNullElse(banner, "");
    service = Objects.requireNonNullElse(service, "");
    version = Objects.requireNonNullElse(version, "");
  }

  /**
   * Creates a TCP fingerprint.
   *
   * @param port TCP port
   * @param banner captured banner or empty
   * @param service classified service
   * @param version extracted version or empty
   * @return fingerprint with protocol {@code "tcp"}
   */
  public static ServiceInfo tcp(int port, String banner, String service, String version) {
    return new ServiceInfo(port, TCP, banner, service, version);
  }
}
