/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Role:</strong> Rejects invalid discovery settings before the scanner allocates threads, sockets or
 * output files.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via
 * {@link IllegalArgumentException} with the offending key in the message.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rackd.validation;
