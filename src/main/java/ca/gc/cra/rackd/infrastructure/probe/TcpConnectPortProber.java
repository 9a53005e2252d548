package ca.gc.cra.rackd.infrastructure.probe;

import ca.gc.cra.rackd.application.port.PortProber;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> TCP connect scan; a port is open when a connection completes within the timeout.
 * <p><strong>Why:</strong> Connect scans need no privilege and are the only port evidence the scanner
 * collects.</p>
 * <p><strong>Concurrency:</strong> All ports of one host are attempted at once on a shared daemon pool, so port
 * fan-out never occupies host worker slots. Each socket is closed as soon as the attempt finishes.</p>
 *
 * @since 0.1.0
 */
public final class TcpConnectPortProber implements PortProber {
  private static final Logger log = LoggerFactory.getLogger(TcpConnectPortProber.class);

  private final ExecutorService attempts;

  /** Creates a prober with its own daemon attempt pool. */
  public TcpConnectPortProber() {
    this(ExecutorFactories.newProbePool("rackd-port"));
  }

  /**
   * Creates a prober using the supplied executor for connection attempts.
   *
   * @param attempts executor running one task per port
   */
  public TcpConnectPortProber(ExecutorService attempts) {
    this.attempts = Objects.requireNonNull(attempts, "attempts");
  }

  @Override
  public List<Integer> probe(String ip, List<Integer> ports, Duration timeout, CancellationToken cancellation)
      throws InterruptedException {
    if (ports == null || ports.isEmpty() || cancellation.isCancelled()) {
      return List.of();
    }
    int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, timeout.toMillis()));
    List<Integer> candidates = new ArrayList<>(new LinkedHashSet<>(ports));
    List<CompletableFuture<Boolean>> pending = new ArrayList<>(candidates.size());
    for (int port : candidates) {
      pending.add(CompletableFuture.supplyAsync(() -> isOpen(ip, port, timeoutMillis), attempts));
    }

    List<Integer> open = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      try {
        if (pending.get(i).get()) {
          open.add(candidates.get(i));
        }
      } catch (ExecutionException ex) {
        log.debug("Connect attempt to {}:{} failed", ip, candidates.get(i), ex.getCause());
      }
    }
    open.sort(null);
    return List.copyOf(open);
  }

  static boolean isOpen(String ip, int port, int timeoutMillis) {
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(ip, port), timeoutMillis);
      return true;
    } catch (IOException ex) {
      return false;
    }
  }
}
