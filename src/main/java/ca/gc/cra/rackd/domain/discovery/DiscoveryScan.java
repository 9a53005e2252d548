package ca.gc.cra.rackd.domain.discovery;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Snapshot of a discovery run's aggregate state.
 * <p><strong>Why:</strong> Listeners and stores receive a consistent value instead of a shared mutable record.</p>
 * <p><strong>Role:</strong> Domain value produced by the orchestrator's progress aggregate at each reporting point.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id scan identifier
 * @param networkId network being scanned
 * @param status lifecycle state
 * @param scanType scan type copied from the rule
 * @param scanDepth depth derived from {@code scanType}
 * @param totalHosts candidate host count; zero until enumeration finishes
 * @param scannedHosts hosts accounted for so far
 * @param foundHosts hosts for which a device record was produced
 * @param progressPercent {@code scannedHosts / totalHosts * 100}
 * @param startedAt run start
 * @param completedAt terminal timestamp, present once the run is completed or failed
 * @param durationSeconds whole seconds between start and completion
 * @param errorMessage failure reason; empty unless {@code status} is {@link ScanStatus#FAILED}
 * @since 0.1.0
 */
public record DiscoveryScan(
    String id,
    String networkId,
    ScanStatus status,
    ScanType scanType,
    int scanDepth,
    int totalHosts,
    int scannedHosts,
    int foundHosts,
    double progressPercent,
    Instant startedAt,
    Optional<Instant> completedAt,
    long durationSeconds,
    String errorMessage) {

  public DiscoveryScan {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(networkId, "networkId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(startedAt, "startedAt");
    completedAt = completedAt == null ? Optional.empty() : completedAt;
    errorMessage = errorMessage == null ? "" : errorMessage;
    if (progressPercent < 0d || progressPercent > 100d) {
      throw new IllegalArgumentException("progressPercent must be within [0,100] (was " + progressPercent + ")");
    }
  }

  /**
   * Indicates whether the run has reached a terminal state.
   *
   * @return {@code true} when completed or failed
   */
  public boolean isTerminal() {
    return status.isTerminal();
  }
}
