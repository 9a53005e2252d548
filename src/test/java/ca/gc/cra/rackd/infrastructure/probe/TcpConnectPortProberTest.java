package ca.gc.cra.rackd.infrastructure.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rackd.application.util.CancellationToken;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TcpConnectPortProberTest {
  private ExecutorService attempts;
  private TcpConnectPortProber prober;

  @BeforeEach
  void setUp() {
    attempts = Executors.newFixedThreadPool(4);
    prober = new TcpConnectPortProber(attempts);
  }

  @AfterEach
  void tearDown() {
    attempts.shutdownNow();
  }

  @Test
  void reportsListeningPortsInAscendingOrder() throws Exception {
    try (ServerSocket high = listen(); ServerSocket low = listen()) {
      int closed = closedPort();
      List<Integer> ports = List.of(high.getLocalPort(), closed, low.getLocalPort(), high.getLocalPort());

      List<Integer> open = prober.probe("127.0.0.1", ports, Duration.ofSeconds(1), CancellationToken.create());

      List<Integer> expected = high.getLocalPort() < low.getLocalPort()
          ? List.of(high.getLocalPort(), low.getLocalPort())
          : List.of(low.getLocalPort(), high.getLocalPort());
      assertEquals(expected, open);
    }
  }

  @Test
  void cancelledTokenSkipsAllAttempts() throws Exception {
    try (ServerSocket server = listen()) {
      CancellationToken token = CancellationToken.create();
      token.cancel();

      assertTrue(prober.probe("127.0.0.1", List.of(server.getLocalPort()), Duration.ofSeconds(1), token).isEmpty());
    }
  }

  @Test
  void emptyPortListReturnsEmpty() throws Exception {
    assertTrue(prober.probe("127.0.0.1", List.of(), Duration.ofSeconds(1), CancellationToken.create()).isEmpty());
  }

  @Test
  void isOpenDetectsRefusedConnections() throws Exception {
    try (ServerSocket server = listen()) {
      assertTrue(TcpConnectPortProber.isOpen("127.0.0.1", server.getLocalPort(), 1_000));
    }
    assertFalse(TcpConnectPortProber.isOpen("127.0.0.1", closedPort(), 1_000));
  }

  private static ServerSocket listen() throws Exception {
    return new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
  }

  private static int closedPort() throws Exception {
    try (ServerSocket socket = listen()) {
      return socket.getLocalPort();
    }
  }
}
