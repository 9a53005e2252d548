package ca.gc.cra.rackd.application.discovery;

import ca.gc.cra.rackd.domain.discovery.OsGuess;
import ca.gc.cra.rackd.domain.discovery.ServiceInfo;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Evidence scoring and passive OS guessing for discovered hosts.
 * <p><strong>Why:</strong> Inventory consumers rank records by how much corroborating evidence was gathered.</p>
 * <p><strong>Role:</strong> Pure application logic; no I/O.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DeviceHeuristics {
  /** Score of a host that reached the scoring stage with no further evidence. */
  public static final int BASE_CONFIDENCE = 50;
  static final int MAC_BONUS = 20;
  static final int HOSTNAME_BONUS = 15;
  static final int OPEN_PORT_BONUS = 10;
  static final int OS_GUESS_BONUS = 5;
  static final int MAX_CONFIDENCE = 100;

  private static final Set<Integer> WINDOWS_PORTS = Set.of(135, 139, 445, 3389);
  private static final Set<Integer> LINUX_PORTS = Set.of(22, 111, 2049);
  private static final Set<Integer> UNIX_PORTS = Set.of(22, 111);
  private static final String SSH = "SSH";

  private DeviceHeuristics() {}

  /**
   * Scores the evidence gathered for a host.
   *
   * @param macAddress resolved MAC or empty
   * @param hostname resolved host name or empty
   * @param openPorts open ports
   * @param osGuess recorded OS guess or empty when OS detection did not run
   * @return score within {@code [50,100]}
   */
  public static int confidence(String macAddress, String hostname, Collection<Integer> openPorts, String osGuess) {
    int score = BASE_CONFIDENCE;
    if (isPresent(macAddress)) {
      score += MAC_BONUS;
    }
    if (isPresent(hostname)) {
      score += HOSTNAME_BONUS;
    }
    if (openPorts != null && !openPorts.isEmpty()) {
      score += OPEN_PORT_BONUS;
    }
    if (isPresent(osGuess)) {
      score += OS_GUESS_BONUS;
    }
    return Math.min(score, MAX_CONFIDENCE);
  }

  /**
   * Guesses the operating system from open ports, then from identified services.
   *
   * <p>Windows ports without Linux ports mean Windows; Linux ports without Windows ports mean Linux; otherwise
   * SSH or RPC ports mean a Unix-like system. An SSH service only upgrades a guess whose family is still
   * unknown.</p>
   *
   * @param openPorts open ports
   * @param services service fingerprints
   * @return guess, {@link OsGuess#UNKNOWN} when nothing matched
   */
  public static OsGuess guessOs(Collection<Integer> openPorts, List<ServiceInfo> services) {
    Collection<Integer> ports = openPorts == null ? List.of() : openPorts;
    boolean windows = containsAny(ports, WINDOWS_PORTS);
    boolean linux = containsAny(ports, LINUX_PORTS);
    boolean unix = containsAny(ports, UNIX_PORTS);

    OsGuess guess = OsGuess.UNKNOWN;
    if (windows && !linux) {
      guess = new OsGuess("Windows", "Windows");
    } else if (linux && !windows) {
      guess = new OsGuess("Linux", "Unix");
    } else if (unix) {
      guess = new OsGuess("Unix-like", "Unix");
    }

    if (guess.isUnknownFamily() && services != null) {
      for (ServiceInfo service : services) {
        if (SSH.equals(service.service())) {
          return new OsGuess("Linux/Unix", "Unix");
        }
      }
    }
    return guess;
  }

  private static boolean containsAny(Collection<Integer> ports, Set<Integer> indicative) {
    for (Integer port : ports) {
      if (indicative.contains(port)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isPresent(String value) {
    return value != null && !value.isEmpty();
  }
}
