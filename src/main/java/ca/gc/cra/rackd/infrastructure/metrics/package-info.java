/**
 * Metrics adapters that bridge discovery counters to OpenTelemetry or a no-op sink.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; every host task updates counters.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code discovery.scan.*}, {@code discovery.host.*},
 * {@code discovery.port.*} and {@code discovery.persist.*}.</p>
 * <p><strong>Security:</strong> Metric attributes carry only metric keys; addresses and banners are never
 * exported.</p>
 */
package ca.gc.cra.rackd.infrastructure.metrics;
