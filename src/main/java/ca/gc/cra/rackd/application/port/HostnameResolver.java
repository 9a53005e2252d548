package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.application.util.CancellationToken;
import java.util.Optional;

/**
 * Reverse name resolution for a host address.
 *
 * @since 0.1.0
 */
public interface HostnameResolver {
  /**
   * Resolves the name registered for {@code ip}.
   *
   * @param ip host address
   * @param cancellation run cancellation
   * @return host name, or empty when the lookup fails or only returns the address itself
   */
  Optional<String> resolve(String ip, CancellationToken cancellation);
}
