/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize remote text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from host workers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Banners are stripped of control characters and truncated.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rackd.logging;
