/**
 * Ports consumed and exposed by the discovery application layer.
 * <p><strong>Role:</strong> Hexagonal boundary; the store, probers, clock and metrics are all injected through
 * these interfaces.</p>
 * <p><strong>Concurrency:</strong> Implementations must tolerate calls from up to the host pool size of
 * concurrent tasks.</p>
 * <p><strong>Metrics:</strong> Port implementations publish under {@code discovery.*}.</p>
 */
package ca.gc.cra.rackd.application.port;
