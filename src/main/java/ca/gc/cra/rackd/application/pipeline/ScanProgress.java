package ca.gc.cra.rackd.application.pipeline;

import ca.gc.cra.rackd.application.port.ScanUpdateListener;
import ca.gc.cra.rackd.domain.discovery.DiscoveryScan;
import ca.gc.cra.rackd.domain.discovery.ScanStatus;
import ca.gc.cra.rackd.domain.discovery.ScanType;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owned aggregate holding a run's counters, status and timestamps.
 * <p><strong>Why:</strong> Every host task reports into one object so counters cannot drift and listeners see
 * consistent snapshots.</p>
 * <p><strong>Role:</strong> Single serialization point of the scan orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Counter updates run under {@code stateLock}, which is never held across
 * listener calls. Deliveries are serialized by {@code reportLock}; a snapshot older than the last delivered one
 * is dropped, so listeners observe non-decreasing {@code scannedHosts}.</p>
 * <p><strong>Observability:</strong> Logs a progress line at every milestone.</p>
 *
 * @since 0.1.0
 */
final class ScanProgress {
  private static final Logger log = LoggerFactory.getLogger(ScanProgress.class);

  private final ReentrantLock stateLock = new ReentrantLock();
  private final ReentrantLock reportLock = new ReentrantLock();
  private final ScanUpdateListener listener;
  private final int progressInterval;

  private final String id;
  private final String networkId;
  private final ScanType scanType;
  private final Instant startedAt;

  private ScanStatus status = ScanStatus.PENDING;
  private int totalHosts;
  private int scannedHosts;
  private int foundHosts;
  private double progressPercent;
  private Instant completedAt;
  private long durationSeconds;
  private String errorMessage = "";

  private int lastDeliveredScanned = -1;

  ScanProgress(
      String id,
      String networkId,
      ScanType scanType,
      Instant startedAt,
      int progressInterval,
      ScanUpdateListener listener) {
    this.id = Objects.requireNonNull(id, "id");
    this.networkId = Objects.requireNonNull(networkId, "networkId");
    this.scanType = scanType;
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    if (progressInterval <= 0) {
      throw new IllegalArgumentException("progressInterval must be positive");
    }
    this.progressInterval = progressInterval;
    this.listener = listener == null ? ScanUpdateListener.NO_OP : listener;
  }

  /** Moves the run to {@code running} and reports it. */
  DiscoveryScan start() {
    DiscoveryScan snapshot;
    stateLock.lock();
    try {
      requireNotTerminal();
      status = ScanStatus.RUNNING;
      snapshot = snapshotLocked();
    } finally {
      stateLock.unlock();
    }
    deliver(snapshot);
    return snapshot;
  }

  /** Records the candidate count and reports it. */
  DiscoveryScan setTotalHosts(int total) {
    if (total < 0) {
      throw new IllegalArgumentException("total must not be negative");
    }
    DiscoveryScan snapshot;
    stateLock.lock();
    try {
      requireNotTerminal();
      totalHosts = total;
      snapshot = snapshotLocked();
    } finally {
      stateLock.unlock();
    }
    deliver(snapshot);
    return snapshot;
  }

  /**
   * Accounts for one finished host and reports on milestones.
   *
   * @param found whether a device record was produced for the host
   */
  void recordHost(boolean found) {
    DiscoveryScan snapshot = null;
    stateLock.lock();
    try {
      scannedHosts++;
      if (found) {
        foundHosts++;
      }
      if (totalHosts > 0) {
        progressPercent = Math.min(100d, scannedHosts * 100d / totalHosts);
      }
      if (scannedHosts % progressInterval == 0 || scannedHosts == totalHosts) {
        snapshot = snapshotLocked();
      }
    } finally {
      stateLock.unlock();
    }
    if (snapshot != null) {
      log.info("Scan progress: {}/{} hosts scanned, {} found",
          snapshot.scannedHosts(), snapshot.totalHosts(), snapshot.foundHosts());
      deliver(snapshot);
    }
  }

  /** Marks the run failed, stamps completion and reports it. */
  DiscoveryScan fail(String message, Instant at) {
    return finish(ScanStatus.FAILED, message, at);
  }

  /** Marks the run completed, stamps completion and reports it. */
  DiscoveryScan complete(Instant at) {
    return finish(ScanStatus.COMPLETED, "", at);
  }

  /** Returns the current state without reporting it. */
  DiscoveryScan snapshot() {
    stateLock.lock();
    try {
      return snapshotLocked();
    } finally {
      stateLock.unlock();
    }
  }

  private DiscoveryScan finish(ScanStatus terminal, String message, Instant at) {
    DiscoveryScan snapshot;
    stateLock.lock();
    try {
      requireNotTerminal();
      status = terminal;
      errorMessage = message == null ? "" : message;
      completedAt = Objects.requireNonNull(at, "at");
      durationSeconds = Math.max(0L, Duration.between(startedAt, completedAt).getSeconds());
      if (terminal == ScanStatus.COMPLETED && scannedHosts == totalHosts) {
        progressPercent = 100d;
      }
      snapshot = snapshotLocked();
    } finally {
      stateLock.unlock();
    }
    deliver(snapshot);
    return snapshot;
  }

  private void requireNotTerminal() {
    if (status.isTerminal()) {
      throw new IllegalStateException("scan " + id + " is already " + status.wireName());
    }
  }

  private DiscoveryScan snapshotLocked() {
    return new DiscoveryScan(
        id,
        networkId,
        status,
        scanType,
        ScanType.depthOf(scanType),
        totalHosts,
        scannedHosts,
        foundHosts,
        progressPercent,
        startedAt,
        Optional.ofNullable(completedAt),
        durationSeconds,
        errorMessage);
  }

  private void deliver(DiscoveryScan snapshot) {
    reportLock.lock();
    try {
      if (snapshot.scannedHosts() < lastDeliveredScanned) {
        log.debug("Dropping stale progress snapshot at {} hosts", snapshot.scannedHosts());
        return;
      }
      lastDeliveredScanned = snapshot.scannedHosts();
      listener.onUpdate(snapshot);
    } catch (RuntimeException ex) {
      log.warn("Scan update listener failed for scan {} ({})", id, snapshot.status().wireName(), ex);
    } finally {
      reportLock.unlock();
    }
  }
}
