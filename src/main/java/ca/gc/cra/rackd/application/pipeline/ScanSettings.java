package ca.gc.cra.rackd.application.pipeline;

import ca.gc.cra.rackd.application.discovery.HostRangeEnumerator;

/**
 * Scanner tuning that is independent of any network's discovery rule.
 *
 * @param hostConcurrency maximum host pipelines running at once
 * @param progressInterval report a snapshot every this many scanned hosts, and on the final host
 * @param maxHosts largest subnet expansion accepted before the run fails
 * @since 0.1.0
 */
public record ScanSettings(int hostConcurrency, int progressInterval, int maxHosts) {
  /** Default host pool size; kept small to limit concurrent store writes. */
  public static final int DEFAULT_HOST_CONCURRENCY = 5;
  /** Default reporting interval in hosts. */
  public static final int DEFAULT_PROGRESS_INTERVAL = 50;

  public ScanSettings {
    if (hostConcurrency <= 0) {
      throw new IllegalArgumentException("hostConcurrency must be positive");
    }
    if (progressInterval <= 0) {
      throw new IllegalArgumentException("progressInterval must be positive");
    }
    if (maxHosts <= 0) {
      throw new IllegalArgumentException("maxHosts must be positive");
    }
  }

  /**
   * Returns the default tuning.
   *
   * @return 5 concurrent hosts, a report every 50 hosts, at most 65536 candidates
   */
  public static ScanSettings defaults() {
    return new ScanSettings(
        DEFAULT_HOST_CONCURRENCY, DEFAULT_PROGRESS_INTERVAL, HostRangeEnumerator.DEFAULT_MAX_HOSTS);
  }
}
