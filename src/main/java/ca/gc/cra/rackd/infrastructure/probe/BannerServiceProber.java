package ca.gc.cra.rackd.infrastructure.probe;

import ca.gc.cra.rackd.application.port.ServiceProber;
import ca.gc.cra.rackd.application.util.CancellationToken;
import ca.gc.cra.rackd.domain.discovery.ServiceCatalog;
import ca.gc.cra.rackd.domain.discovery.ServiceInfo;
import ca.gc.cra.rackd.logging.Logs;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Grabs one banner line per open port and classifies the service behind it.
 * <p><strong>How:</strong> Ports are visited in order on the calling thread. HTTP ports receive a minimal
 * {@code GET}; every other port is read passively. The first line (up to {@value #MAX_BANNER_BYTES} bytes) is
 * matched against well-known protocol tokens, then against the static port table.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across host workers.</p>
 * <p><strong>Security:</strong> Banners are logged only after control characters are stripped.</p>
 *
 * @since 0.1.0
 */
public final class BannerServiceProber implements ServiceProber {
  private static final Logger log = LoggerFactory.getLogger(BannerServiceProber.class);

  /** Default connect deadline per port. */
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(3);
  /** Default deadline for the first banner line. */
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(2);
  static final int MAX_BANNER_BYTES = 1024;
  private static final int LOGGED_BANNER_BYTES = 120;
  private static final byte[] HTTP_PROBE = "GET / HTTP/1.0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
  private static final String UNKNOWN = "unknown";

  // Checked in order; the first token present in the upper-cased banner wins.
  private static final String[][] SIGNATURES = {
      {"SSH", "SSH"},
      {"FTP", "FTP"},
      {"HTTP", "HTTP"},
      {"SMTP", "SMTP"},
      {"MYSQL", "MySQL"},
      {"POSTGRESQL", "PostgreSQL"},
  };

  private final Duration connectTimeout;
  private final Duration readTimeout;

  /** Creates a prober with the default 3 s connect and 2 s read deadlines. */
  public BannerServiceProber() {
    this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
  }

  /**
   * Creates a prober with explicit deadlines.
   *
   * @param connectTimeout connect deadline per port
   * @param readTimeout overall deadline for the first banner line
   */
  public BannerServiceProber(Duration connectTimeout, Duration readTimeout) {
    this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
    this.readTimeout = requirePositive(readTimeout, "readTimeout");
  }

  @Override
  public List<ServiceInfo> probe(String ip, List<Integer> openPorts, CancellationToken cancellation) {
    if (openPorts == null || openPorts.isEmpty()) {
      return List.of();
    }
    List<ServiceInfo> services = new ArrayList<>(openPorts.size());
    for (int port : openPorts) {
      if (cancellation.isCancelled()) {
        break;
      }
      probePort(ip, port).ifPresent(services::add);
    }
    return List.copyOf(services);
  }

  private Optional<ServiceInfo> probePort(String ip, int port) {
    try (Socket socket = new Socket()) {
      try {
        socket.connect(new InetSocketAddress(ip, port), toMillis(connectTimeout));
      } catch (IOException ex) {
        log.debug("Service connect to {}:{} failed: {}", ip, port, ex.getMessage());
        return Optional.empty();
      }
      Optional<String> line = grabBanner(socket, port);
      if (line.isEmpty()) {
        return Optional.of(ServiceInfo.tcp(port, "", serviceForPort(port), ""));
      }
      String banner = line.get().trim();
      log.debug("Banner on {}:{}: {}", ip, port, Logs.banner(banner, LOGGED_BANNER_BYTES));
      return Optional.of(ServiceInfo.tcp(port, banner, parseService(banner, port), parseVersion(banner)));
    } catch (IOException ex) {
      log.debug("Closing service probe socket for {}:{} failed: {}", ip, port, ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<String> grabBanner(Socket socket, int port) {
    long deadline = System.nanoTime() + readTimeout.toNanos();
    try {
      socket.setSoTimeout(toMillis(readTimeout));
      if (ServiceCatalog.HTTP_PROBE_PORTS.contains(port)) {
        OutputStream out = socket.getOutputStream();
        out.write(HTTP_PROBE);
        out.flush();
      }
      InputStream in = new BufferedInputStream(socket.getInputStream(), MAX_BANNER_BYTES);
      return readLine(in, socket::setSoTimeout, deadline);
    } catch (IOException ex) {
      return Optional.empty();
    }
  }

  /**
   * Reads bytes up to and excluding the first {@code '\n'}, giving up once {@code deadlineNanos} passes.
   *
   * <p>Before each read the remaining time is handed to {@code readTimeout}, so a peer that trickles bytes
   * cannot stretch the read beyond the deadline.</p>
   *
   * @param in source stream
   * @param readTimeout applies the per-read timeout in milliseconds, e.g. {@link Socket#setSoTimeout(int)}
   * @param deadlineNanos absolute {@link System#nanoTime()} deadline
   * @return the line, or empty on timeout, read error or end of stream before a newline; a line reaching
   *     {@value #MAX_BANNER_BYTES} bytes is returned as read
   */
  static Optional<String> readLine(InputStream in, ReadTimeout readTimeout, long deadlineNanos) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(128);
    try {
      while (buffer.size() < MAX_BANNER_BYTES) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
          return Optional.empty();
        }
        long millis = Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining));
        readTimeout.apply((int) Math.min(Integer.MAX_VALUE, millis));
        int b = in.read();
        if (b < 0) {
          return Optional.empty();
        }
        if (b == '\n') {
          return Optional.of(buffer.toString(StandardCharsets.ISO_8859_1));
        }
        buffer.write(b);
      }
      return Optional.of(buffer.toString(StandardCharsets.ISO_8859_1));
    } catch (IOException ex) {
      return Optional.empty();
    }
  }

  /** Applies a read timeout in milliseconds before the next blocking read. */
  @FunctionalInterface
  interface ReadTimeout {
    void apply(int millis) throws IOException;
  }

  /**
   * Classifies a banner.
   *
   * @param banner trimmed banner line
   * @param port port the banner came from
   * @return protocol name from the banner, else from the port table, else {@code "unknown"}
   */
  static String parseService(String banner, int port) {
    String upper = banner.toUpperCase(Locale.ROOT);
    for (String[] signature : SIGNATURES) {
      if (upper.contains(signature[0])) {
        return signature[1];
      }
    }
    return serviceForPort(port);
  }

  /**
   * Extracts a version from a banner.
   *
   * @param banner trimmed banner line
   * @return the word after the first word containing {@code v} or {@code Version}, else an empty string
   */
  static String parseVersion(String banner) {
    String[] words = banner.trim().split("\\s+");
    for (int i = 0; i + 1 < words.length; i++) {
      if (words[i].contains("v") || words[i].contains("Version")) {
        return words[i + 1];
      }
    }
    return "";
  }

  private static String serviceForPort(int port) {
    return ServiceCatalog.serviceForPort(port).orElse(UNKNOWN);
  }

  private static int toMillis(Duration timeout) {
    return (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }
}
