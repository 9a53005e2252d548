/**
 * Application-level helpers shared by use cases and probers.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.rackd.application.util.CancellationToken} is safe to read from
 * any host task.</p>
 */
package ca.gc.cra.rackd.application.util;
