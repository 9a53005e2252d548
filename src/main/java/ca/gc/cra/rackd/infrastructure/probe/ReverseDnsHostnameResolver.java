package ca.gc.cra.rackd.infrastructure.probe;

import ca.gc.cra.rackd.application.port.HostnameResolver;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.net.Cidr;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PTR lookup through the platform resolver.
 *
 * @since 0.1.0
 */
public final class ReverseDnsHostnameResolver implements HostnameResolver {
  private static final Logger log = LoggerFactory.getLogger(ReverseDnsHostnameResolver.class);

  @Override
  public Optional<String> resolve(String ip, CancellationToken cancellation) {
    if (cancellation.isCancelled()) {
      return Optional.empty();
    }
    Optional<byte[]> address = Cidr.parseAddress(ip);
    if (address.isEmpty()) {
      return Optional.empty();
    }
    try {
      String name = InetAddress.getByAddress(address.get()).getCanonicalHostName();
      // The literal is echoed back when no PTR record exists.
      if (name == null || name.isBlank() || Cidr.parseAddress(name).isPresent()) {
        return Optional.empty();
      }
      return Optional.of(name);
    } catch (UnknownHostException ex) {
      log.debug("Reverse lookup failed for {}: {}", ip, ex.getMessage());
      return Optional.empty();
    }
  }
}
