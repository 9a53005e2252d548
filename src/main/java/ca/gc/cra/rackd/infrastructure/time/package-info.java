/**
 * Time sources implementing {@link ca.gc.cra.rackd.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.rackd.infrastructure.time;
