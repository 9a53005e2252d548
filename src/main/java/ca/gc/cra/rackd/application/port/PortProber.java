package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.application.util.CancellationToken;
import java.time.Duration;
import java.util.List;

/**
 * TCP connect scan of a host's candidate ports.
 *
 * @since 0.1.0
 */
public interface PortProber {
  /**
   * Attempts one connection per port, concurrently.
   *
   * @param ip host address
   * @param ports candidate ports
   * @param timeout connect deadline per port
   * @param cancellation run cancellation
   * @return ascending ports whose connection succeeded within {@code timeout}
   * @throws InterruptedException when the calling thread is interrupted while waiting for attempts
   */
  List<Integer> probe(String ip, List<Integer> ports, Duration timeout, CancellationToken cancellation)
      throws InterruptedException;
}
