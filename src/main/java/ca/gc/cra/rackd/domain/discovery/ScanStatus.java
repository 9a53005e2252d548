package ca.gc.cra.rackd.domain.discovery;

/**
 * Lifecycle states of a discovery run: {@code pending -> running -> completed | failed}.
 *
 * @since 0.1.0
 */
public enum ScanStatus {
  /** Created but not started. */
  PENDING("pending"),
  /** Hosts are being probed. */
  RUNNING("running"),
  /** Every candidate host was accounted for. */
  COMPLETED("completed"),
  /** Aborted before host work began. */
  FAILED("failed");

  private final String wireName;

  ScanStatus(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the lower-case name used in persisted records.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Indicates whether no further transitions are allowed.
   *
   * @return {@code true} for {@link #COMPLETED} and {@link #FAILED}
   */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
