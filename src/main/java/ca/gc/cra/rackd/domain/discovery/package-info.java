/**
 * Discovery domain model: rules, scan records, discovered devices and service fingerprints.
 * <p><strong>Role:</strong> Domain layer shared by the orchestrator, probers and store adapters; no infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Records are immutable; builders are confined to a single host task.</p>
 * <p><strong>Security:</strong> Banners are untrusted remote input and are truncated before logging.</p>
 */
package ca.gc.cra.rackd.domain.discovery;
