/**
 * Configuration loading and object-graph wiring for the discovery CLI.
 * <p>Settings are layered as embedded defaults ({@link ca.gc.cra.rackd.config.DiscoveryDefaults}), then a YAML
 * file ({@link ca.gc.cra.rackd.config.YamlConfigLoader}), then CLI {@code key=value} arguments
 * ({@link ca.gc.cra.rackd.config.ConfigMerger}), and validated into a
 * {@link ca.gc.cra.rackd.config.DiscoveryConfig}.</p>
 * <p>Scanner implementations are pluggable through
 * {@link ca.gc.cra.rackd.config.NetworkScannerProvider}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rackd.config;
