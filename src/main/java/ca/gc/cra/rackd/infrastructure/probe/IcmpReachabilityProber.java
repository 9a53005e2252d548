package ca.gc.cra.rackd.infrastructure.probe;

import ca.gc.cra.rackd.application.port.ReachabilityProber;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.net.Reachability;
import java.io.IOException;
import java.net.InetAddress;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Echo-request reachability check backed by {@link InetAddress#isReachable(int)}.
 *
 * <p>When the process lacks raw socket privilege every probe returns {@link Reachability#UNKNOWN}; the JDK would
 * otherwise fall back to a TCP echo-port attempt whose negative answer means little.</p>
 *
 * @since 0.1.0
 */
public final class IcmpReachabilityProber implements ReachabilityProber {
  private static final Logger log = LoggerFactory.getLogger(IcmpReachabilityProber.class);

  private final boolean privileged;

  /**
   * Creates the prober.
   *
   * @param privileged result of {@link RawSocketPrivilegeProbe#detect()}
   */
  public IcmpReachabilityProber(boolean privileged) {
    this.privileged = privileged;
  }

  @Override
  public Reachability probe(String ip, Duration timeout, CancellationToken cancellation) {
    if (!privileged || cancellation.isCancelled()) {
      return Reachability.UNKNOWN;
    }
    try {
      InetAddress address = InetAddress.getByName(ip);
      int millis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
      return address.isReachable(millis) ? Reachability.ALIVE : Reachability.NOT_ALIVE;
    } catch (IOException ex) {
      log.debug("Echo request to {} failed: {}", ip, ex.getMessage());
      return Reachability.UNKNOWN;
    }
  }

  @Override
  public boolean privileged() {
    return privileged;
  }
}
