package ca.gc.cra.rackd.application.discovery;

import ca.gc.cra.rackd.domain.net.Cidr;
import ca.gc.cra.rackd.domain.net.InvalidSubnetException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * <strong>What:</strong> Expands a CIDR subnet into its candidate host addresses.
 * <p><strong>Why:</strong> The orchestrator dispatches one probe task per candidate, so it needs the full,
 * ordered list before work starts.</p>
 * <p><strong>Role:</strong> Application service; exclusion filtering is left to {@link ExclusionMatcher}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(n) in the number of candidates; bounded by {@code maxHosts}.</p>
 *
 * @since 0.1.0
 */
public final class HostRangeEnumerator {
  /** Largest candidate count accepted by default (a /16 holds 65534). */
  public static final int DEFAULT_MAX_HOSTS = 65_536;

  private static final int POINT_TO_POINT_PREFIX = 31;

  private final int maxHosts;

  /** Creates an enumerator limited to {@link #DEFAULT_MAX_HOSTS}. */
  public HostRangeEnumerator() {
    this(DEFAULT_MAX_HOSTS);
  }

  /**
   * Creates an enumerator.
   *
   * @param maxHosts largest candidate count a subnet may expand to
   */
  public HostRangeEnumerator(int maxHosts) {
    if (maxHosts <= 0) {
      throw new IllegalArgumentException("maxHosts must be positive");
    }
    this.maxHosts = maxHosts;
  }

  /**
   * Lists candidate addresses in ascending order.
   *
   * <p>Blocks with prefix 30 or shorter drop the network and broadcast addresses; /31 and /32 keep every
   * address.</p>
   *
   * @param subnet CIDR text
   * @return ordered candidate addresses
   * @throws InvalidSubnetException when the subnet does not parse or expands beyond {@code maxHosts}
   */
  public List<String> enumerate(String subnet) throws InvalidSubnetException {
    Cidr cidr = Cidr.parse(subnet);
    boolean dropEndpoints = cidr.prefixLength() < POINT_TO_POINT_PREFIX;
    BigInteger candidates = cidr.size().subtract(BigInteger.valueOf(dropEndpoints ? 2 : 0));
    if (candidates.compareTo(BigInteger.valueOf(maxHosts)) > 0) {
      throw new InvalidSubnetException(
          "subnet " + subnet.trim() + " expands to " + candidates + " hosts, more than maxHosts " + maxHosts);
    }

    byte[] network = cidr.network();
    byte[] broadcast = cidr.broadcast();
    List<String> hosts = new ArrayList<>(candidates.intValue());
    byte[] current = network.clone();
    while (cidr.contains(current)) {
      boolean endpoint = Arrays.equals(current, network) || Arrays.equals(current, broadcast);
      if (!dropEndpoints || !endpoint) {
        hosts.add(Cidr.format(current));
      }
      if (!increment(current)) {
        break;
      }
    }
    return hosts;
  }

  /**
   * Adds one to a big-endian address, carrying across bytes.
   *
   * @return {@code false} when the address wrapped past its maximum value
   */
  static boolean increment(byte[] address) {
    for (int i = address.length - 1; i >= 0; i--) {
      address[i]++;
      if (address[i] != 0) {
        return true;
      }
    }
    return false;
  }
}
