package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.net.Reachability;
import java.time.Duration;

/**
 * ICMP liveness check for a single host.
 *
 * <p>Implementations report {@link Reachability#UNKNOWN} rather than throwing when the process lacks the
 * privilege to send echo requests or the probe itself fails.</p>
 *
 * @since 0.1.0
 */
public interface ReachabilityProber {
  /**
   * Sends one echo request.
   *
   * @param ip host address
   * @param timeout reply deadline
   * @param cancellation run cancellation; not required to abort an in-flight request
   * @return liveness verdict
   */
  Reachability probe(String ip, Duration timeout, CancellationToken cancellation);

  /**
   * Indicates whether echo requests can actually be sent.
   *
   * @return {@code false} when every probe degrades to {@link Reachability#UNKNOWN}
   */
  boolean privileged();
}
