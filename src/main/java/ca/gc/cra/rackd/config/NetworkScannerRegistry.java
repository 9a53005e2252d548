package ca.gc.cra.rackd.config;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Name-indexed set of {@link NetworkScannerProvider}s.
 * <p><strong>Why:</strong> Lets deployments add a scanner by dropping a jar on the classpath; the
 * {@code scanner} key picks one.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class NetworkScannerRegistry {
  private static final Logger log = LoggerFactory.getLogger(NetworkScannerRegistry.class);

  private final Map<String, NetworkScannerProvider> providers;

  /**
   * Creates a registry from explicit providers; later duplicates of a name are ignored.
   *
   * @param providers providers to index
   */
  public NetworkScannerRegistry(Iterable<? extends NetworkScannerProvider> providers) {
    Map<String, NetworkScannerProvider> byName = new TreeMap<>();
    for (NetworkScannerProvider provider : providers) {
      String name = provider.name().trim().toLowerCase(Locale.ROOT);
      NetworkScannerProvider previous = byName.putIfAbsent(name, provider);
      if (previous != null) {
        log.warn("Ignoring duplicate scanner provider {} ({}); keeping {}",
            name, provider.getClass().getName(), previous.getClass().getName());
      }
    }
    this.providers = Collections.unmodifiableMap(byName);
  }

  /**
   * Loads providers with {@link ServiceLoader}; the builtin provider is always present.
   *
   * @return registry of discovered providers
   */
  public static NetworkScannerRegistry load() {
    Map<String, NetworkScannerProvider> found = new TreeMap<>();
    found.put(BuiltinNetworkScannerProvider.NAME, new BuiltinNetworkScannerProvider());
    try {
      for (NetworkScannerProvider provider : ServiceLoader.load(NetworkScannerProvider.class)) {
        String name = provider.name().trim().toLowerCase(Locale.ROOT);
        if (!BuiltinNetworkScannerProvider.NAME.equals(name)) {
          found.putIfAbsent(name, provider);
        }
      }
    } catch (ServiceConfigurationError err) {
      log.warn("Failed to load scanner providers: {}", err.getMessage());
    }
    return new NetworkScannerRegistry(found.values());
  }

  /**
   * Looks up a provider by name, case-insensitively.
   *
   * @param name provider name
   * @return matching provider
   * @throws IllegalArgumentException when no provider has that name
   */
  public NetworkScannerProvider lookup(String name) {
    Objects.requireNonNull(name, "name");
    NetworkScannerProvider provider = providers.get(name.trim().toLowerCase(Locale.ROOT));
    if (provider == null) {
      throw new IllegalArgumentException(
          "scanner must be one of " + providers.keySet() + " (was " + name + ")");
    }
    return provider;
  }

  /** @return registered provider names in sorted order */
  public Collection<String> names() {
    return providers.keySet();
  }
}
