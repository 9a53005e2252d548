package ca.gc.cra.rackd.domain.net;

/**
 * Outcome of an ICMP liveness check.
 *
 * @since 0.1.0
 */
public enum Reachability {
  /** Echo reply received within the timeout. */
  ALIVE,
  /** No reply within the timeout. */
  NOT_ALIVE,
  /** Check not performed, typically for lack of raw socket privilege, or failed. */
  UNKNOWN;

  /**
   * Indicates positive liveness evidence.
   *
   * @return {@code true} only for {@link #ALIVE}
   */
  public boolean isAlive() {
    return this == ALIVE;
  }
}
