/**
 * Network primitives: CIDR blocks, address literals and reachability verdicts.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share across host tasks.</p>
 */
package ca.gc.cra.rackd.domain.net;
