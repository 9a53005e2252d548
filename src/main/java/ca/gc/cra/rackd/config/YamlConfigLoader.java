package ca.gc.cra.rackd.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a discovery config file such as:
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * scan:
 *   subnet: 10.0.0.0/24
 *   excludeIps: [10.0.0.1, 10.0.0.128/25]
 * }</pre>
 *
 * <p>Keys under {@code common} apply first and the section named after the command overrides them. Nested
 * mappings become dotted keys. Only {@link #LIST_KEYS} may hold sequences; their items are joined with commas so
 * the result reads the same as the CLI form.</p>
 */
public final class YamlConfigLoader {
  static final Set<String> LIST_KEYS = Set.of("excludeIps", "excludeHosts", "customPorts");
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * @param path YAML file
   * @param command section to overlay on {@code common}, matched case-insensitively
   * @return flattened settings, or empty when {@code path} does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is malformed or shaped wrongly
   */
  public static Optional<Map<String, String>> load(Path path, String command) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(command, "command").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = mapping(document, "document root");
    Map<String, String> settings = new LinkedHashMap<>();
    for (String name : List.of(COMMON, section)) {
      Object node = sectionNamed(root, name);
      if (node != null) {
        flattenInto(settings, "", mapping(node, name));
      }
    }
    return Optional.of(Map.copyOf(settings));
  }

  private static Object sectionNamed(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(e -> e.getKey().trim().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> result = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String text) || text.isBlank()) {
        throw new IllegalArgumentException(where + " has a key that is not a non-blank string: " + key);
      }
      result.put(text, value);
    });
    return result;
  }

  private static void flattenInto(Map<String, String> settings, String prefix, Map<String, Object> node) {
    node.forEach((name, value) -> {
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      if (value instanceof Map<?, ?> nested) {
        flattenInto(settings, key, mapping(nested, key));
      } else if (value instanceof Iterable<?> items) {
        settings.put(key, joinList(key, items));
      } else {
        settings.put(key, value == null ? "" : String.valueOf(value));
      }
    });
  }

  private static String joinList(String key, Iterable<?> items) {
    if (!LIST_KEYS.contains(key)) {
      throw new IllegalArgumentException(key + " takes a single value, not a YAML list");
    }
    return StreamSupport.stream(items.spliterator(), false)
        .filter(Objects::nonNull)
        .map(item -> {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException(key + " list items must be scalars");
          }
          return item.toString();
        })
        .collect(Collectors.joining(","));
  }
}
