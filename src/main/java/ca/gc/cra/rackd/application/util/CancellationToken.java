package ca.gc.cra.rackd.application.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through a discovery run.
 *
 * <p>Cancellation stops new work from starting. Probes already blocked on the network are not interrupted;
 * their timeouts bound how long they keep running.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(null, false);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CancellationToken parent;
  private final boolean cancellable;

  private CancellationToken(CancellationToken parent, boolean cancellable) {
    this.parent = parent;
    this.cancellable = cancellable;
  }

  /**
   * Creates an independent token.
   *
   * @return token that is not cancelled
   */
  public static CancellationToken create() {
    return new CancellationToken(null, true);
  }

  /**
   * Returns a token that is never cancelled.
   *
   * @return shared inert token; {@link #cancel()} is ignored
   */
  public static CancellationToken none() {
    return NONE;
  }

  /**
   * Creates a child that reports cancellation when either it or this token is cancelled.
   *
   * @return linked child token
   */
  public CancellationToken newChild() {
    return new CancellationToken(this, true);
  }

  /** Requests cancellation; idempotent. */
  public void cancel() {
    if (cancellable) {
      cancelled.set(true);
    }
  }

  /**
   * Indicates whether this token or any ancestor was cancelled.
   *
   * @return {@code true} once cancellation was requested
   */
  public boolean isCancelled() {
    return cancelled.get() || (parent != null && parent.isCancelled());
  }
}
