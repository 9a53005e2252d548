package ca.gc.cra.rackd.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock timestamps to discovery runs.
 * <p><strong>Why:</strong> Scan start/completion times, durations and {@code lastSeen} values come from one
 * injectable source so tests can pin them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; host tasks read the clock
 * concurrently.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.rackd.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
