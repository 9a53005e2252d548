package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.application.util.CancellationToken;
import java.util.Optional;

/**
 * Resolves the link-layer address of a host on a directly attached subnet.
 *
 * @since 0.1.0
 */
public interface MacAddressResolver {
  /**
   * Looks up the MAC address for {@code ip}.
   *
   * @param ip host address
   * @param cancellation run cancellation
   * @return lower-case colon separated MAC, or empty when unresolved
   */
  Optional<String> resolve(String ip, CancellationToken cancellation);
}
