package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.discovery.ServiceInfo;
import java.util.List;

/**
 * Banner capture and service classification for open ports.
 *
 * @since 0.1.0
 */
public interface ServiceProber {
  /**
   * Fingerprints each open port in turn.
   *
   * @param ip host address
   * @param openPorts ports that accepted a connection
   * @param cancellation run cancellation; remaining ports are skipped once cancelled
   * @return one fingerprint per port that accepted a fresh connection, in port order
   */
  List<ServiceInfo> probe(String ip, List<Integer> openPorts, CancellationToken cancellation);
}
