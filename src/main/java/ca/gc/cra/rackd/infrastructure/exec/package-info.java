/**
 * Executor factories for discovery worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the host pool and the probe fan-out pool.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed executors.</p>
 * <p><strong>Security:</strong> Thread names carry only a scan id prefix, never addresses.</p>
 */
package ca.gc.cra.rackd.infrastructure.exec;
