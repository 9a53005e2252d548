package ca.gc.cra.rackd.infrastructure.time;

import ca.gc.cra.rackd.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds used for scan timestamps and device {@code lastSeen} values.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing; scan durations may be skewed by
   *     wall-clock adjustments.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
