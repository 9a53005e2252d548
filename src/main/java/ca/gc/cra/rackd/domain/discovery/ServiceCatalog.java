package ca.gc.cra.rackd.domain.discovery;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known TCP ports and their conventional service names.
 *
 * @since 0.1.0
 */
public final class ServiceCatalog {
  /** Ports probed by the {@code common}, {@code full} and empty {@code custom} policies. */
  public static final List<Integer> COMMON_PORTS = List.of(
      21, 22, 23, 25, 53, 80, 110, 111, 135, 139, 143, 443, 445, 993, 995, 1723, 3306, 3389, 5900, 8080);

  /** Ports that receive an HTTP request before the banner read. */
  public static final List<Integer> HTTP_PROBE_PORTS = List.of(80, 8080);

  private static final Map<Integer, String> SERVICES_BY_PORT = Map.ofEntries(
      Map.entry(21, "FTP"),
      Map.entry(22, "SSH"),
      Map.entry(23, "Telnet"),
      Map.entry(25, "SMTP"),
      Map.entry(53, "DNS"),
      Map.entry(80, "HTTP"),
      Map.entry(110, "POP3"),
      Map.entry(143, "IMAP"),
      Map.entry(443, "HTTPS"),
      Map.entry(3306, "MySQL"),
      Map.entry(3389, "RDP"),
      Map.entry(5432, "PostgreSQL"),
      Map.entry(5900, "VNC"),
      Map.entry(6379, "Redis"),
      Map.entry(8080, "HTTP-Alt"),
      Map.entry(27017, "MongoDB"));

  private ServiceCatalog() {}

  /**
   * Looks up the conventional service for a port.
   *
   * @param port TCP port
   * @return service name, or empty when the port is not catalogued
   */
  public static Optional<String> serviceForPort(int port) {
    return Optional.ofNullable(SERVICES_BY_PORT.get(port));
  }

  /**
   * Resolves the port list for a rule's port policy.
   *
   * @param rule discovery rule
   * @return custom ports for a non-empty {@code custom} policy, otherwise {@link #COMMON_PORTS}
   */
  public static List<Integer> portsFor(DiscoveryRule rule) {
    if (rule.portScanType() == PortScanType.CUSTOM && !rule.customPorts().isEmpty()) {
      return rule.customPorts();
    }
    return COMMON_PORTS;
  }
}
