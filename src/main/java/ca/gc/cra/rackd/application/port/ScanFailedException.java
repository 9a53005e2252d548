package ca.gc.cra.rackd.application.port;

import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import java.util.Objects;

/**
 * Raised when a scan aborts before host work begins, because the network could not be resolved or its subnet
 * could not be enumerated.
 *
 * @since 0.1.0
 */
public class ScanFailedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient DiscoveryScan scan;

  /**
   * Creates the exception.
   *
   * @param scan terminal snapshot with status {@code failed}
   * @param cause underlying failure
   */
  public ScanFailedException(DiscoveryScan scan, Throwable cause) {
    super(Objects.requireNonNull(scan, "scan").errorMessage(), cause);
    this.scan = scan;
  }

  /** @return terminal snapshot reported for the failed run */
  public DiscoveryScan scan() {
    return scan;
  }
}
