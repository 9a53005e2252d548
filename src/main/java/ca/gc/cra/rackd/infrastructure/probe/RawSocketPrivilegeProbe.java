package ca.gc.cra.rackd.infrastructure.probe;

import java.util.List;
import org.pcap4j.core.PcapHandle;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface;
import org.pcap4j.core.PcapNetworkInterface.PromiscuousMode;
import org.pcap4j.core.Pcaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Detects whether this process may open raw sockets, which ICMP echo requires.
 * <p><strong>Why:</strong> Without the privilege every reachability probe silently degrades; detecting it once
 * lets the scanner warn operators and skip pointless attempts.</p>
 * <p><strong>How:</strong> Opens and immediately closes a non-promiscuous libpcap handle on the first
 * non-loopback interface. Any failure, including a missing native library, counts as unprivileged.</p>
 * <p><strong>Thread-safety:</strong> Stateless; call {@link #detect()} once during wiring.</p>
 *
 * @since 0.1.0
 */
public final class RawSocketPrivilegeProbe {
  private static final Logger log = LoggerFactory.getLogger(RawSocketPrivilegeProbe.class);
  private static final int SNAPLEN = 64;
  private static final int TIMEOUT_MILLIS = 10;

  private RawSocketPrivilegeProbe() {}

  /**
   * Checks raw socket privilege.
   *
   * @return {@code true} when a live capture handle could be opened
   */
  public static boolean detect() {
    try {
      List<PcapNetworkInterface> devices = Pcaps.findAllDevs();
      PcapNetworkInterface candidate = null;
      for (PcapNetworkInterface device : devices) {
        if (!device.isLoopBack()) {
          candidate = device;
          break;
        }
      }
      if (candidate == null) {
        log.warn("No non-loopback interface visible; ICMP reachability disabled, hosts report unknown");
        return false;
      }
      PcapHandle handle = candidate.openLive(SNAPLEN, PromiscuousMode.NONPROMISCUOUS, TIMEOUT_MILLIS);
      handle.close();
      log.debug("Raw socket privilege confirmed on {}", candidate.getName());
      return true;
    } catch (PcapNativeException | RuntimeException ex) {
      log.warn("Raw socket privilege unavailable ({}); ICMP reachability disabled, hosts report unknown",
          ex.getMessage());
      return false;
    } catch (LinkageError err) {
      log.warn("libpcap not loadable ({}); ICMP reachability disabled, hosts report unknown", err.getMessage());
      return false;
    }
  }
}
