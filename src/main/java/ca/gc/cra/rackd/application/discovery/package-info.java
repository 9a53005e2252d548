/**
 * Pure discovery logic: subnet expansion, exclusion matching, confidence scoring and OS guessing.
 * <p><strong>Role:</strong> Application services with no I/O, invoked by the scan pipeline.</p>
 * <p><strong>Concurrency:</strong> Immutable or stateless; safe to share across host tasks.</p>
 */
package ca.gc.cra.rackd.application.discovery;
