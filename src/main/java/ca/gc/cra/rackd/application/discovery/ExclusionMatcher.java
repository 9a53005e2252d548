package ca.gc.cra.rackd.application.discovery;

import ca.gc.cra.rackd.domain.discovery.DiscoveryRule;
import ca.gc.cra.rackd.domain.net.Cidr;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a candidate host is skipped by a rule's exclusion lists.
 *
 * <p>Address entries match by literal equality or CIDR containment; malformed entries never match.
 * Host name entries match case-insensitively, ignoring a trailing dot. Immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ExclusionMatcher {
  private final Set<String> literals = new LinkedHashSet<>();
  private final List<byte[]> literalAddresses = new ArrayList<>();
  private final List<Cidr> blocks = new ArrayList<>();
  private final Set<String> hostnames = new LinkedHashSet<>();

  /**
   * Creates a matcher.
   *
   * @param excludeIps literal addresses or CIDR blocks
   * @param excludeHosts host names
   */
  public ExclusionMatcher(List<String> excludeIps, List<String> excludeHosts) {
    if (excludeIps != null) {
      for (String entry : excludeIps) {
        if (entry == null || entry.isBlank()) {
          continue;
        }
        String trimmed = entry.trim();
        if (trimmed.indexOf('/') >= 0) {
          Cidr.tryParse(trimmed).ifPresent(blocks::add);
        } else {
          literals.add(trimmed);
          Cidr.parseAddress(trimmed).ifPresent(literalAddresses::add);
        }
      }
    }
    if (excludeHosts != null) {
      for (String host : excludeHosts) {
        normalizeHostname(host).ifPresent(hostnames::add);
      }
    }
  }

  /**
   * Builds a matcher for a rule's {@code excludeIps} and {@code excludeHosts}.
   *
   * @param rule discovery rule
   * @return matcher
   */
  public static ExclusionMatcher forRule(DiscoveryRule rule) {
    return new ExclusionMatcher(rule.excludeIps(), rule.excludeHosts());
  }

  /**
   * Tests an address against the address exclusions.
   *
   * @param ip candidate address
   * @return {@code true} when a literal entry equals it or a CIDR entry contains it
   */
  public boolean isExcluded(String ip) {
    if (ip == null) {
      return false;
    }
    if (literals.contains(ip)) {
      return true;
    }
    Optional<byte[]> parsed = Cidr.parseAddress(ip);
    if (parsed.isEmpty()) {
      return false;
    }
    byte[] address = parsed.get();
    for (byte[] literal : literalAddresses) {
      if (Arrays.equals(literal, address)) {
        return true;
      }
    }
    for (Cidr block : blocks) {
      if (block.contains(address)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Tests a resolved host name against the host name exclusions.
   *
   * @param hostname reverse-resolved name
   * @return {@code true} when an entry names the same host
   */
  public boolean isExcludedHostname(String hostname) {
    return normalizeHostname(hostname).map(hostnames::contains).orElse(false);
  }

  /** @return {@code true} when at least one host name exclusion is configured */
  public boolean hasHostnameExclusions() {
    return !hostnames.isEmpty();
  }

  private static Optional<String> normalizeHostname(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String name = raw.trim().toLowerCase(Locale.ROOT);
    if (name.endsWith(".")) {
      name = name.substring(0, name.length() - 1);
    }
    return name.isEmpty() ? Optional.empty() : Optional.of(name);
  }
}
