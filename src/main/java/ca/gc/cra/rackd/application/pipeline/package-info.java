/**
 * Discovery run orchestration.
 * <p>{@link ca.gc.cra.rackd.application.pipeline.NetworkDiscoveryUseCase} resolves a network, expands its
 * subnet and fans host probes out over a bounded pool. Per-run counters live in a private progress aggregate so
 * listeners observe consistent, non-decreasing snapshots.</p>
 * <p>Host workers are named {@code rackd-scan-<scanId>-*}; operational counters surface through
 * {@link ca.gc.cra.rackd.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rackd.application.pipeline;
