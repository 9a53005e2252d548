/**
 * Store adapters for discovery results.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.rackd.application.port.DiscoveryStorePort} in memory and
 * bridges scan snapshots into the store.</p>
 * <p><strong>Concurrency:</strong> Adapters accept concurrent upserts from every host worker.</p>
 */
package ca.gc.cra.rackd.infrastructure.persistence;
