package ca.gc.cra.rackd.validation;

import ca.gc.cra.rackd.domain.net.Cidr;
import ca.gc.cra.rackd.domain.net.InvalidSubnetException;

/**
 * Subnet, address and host name validation for discovery configuration.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  private Net() {}

  /**
   * Validates CIDR notation.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate subnet
   * @return trimmed subnet text
   * @throws IllegalArgumentException if the text is not an IPv4 or IPv6 CIDR block
   */
  public static String requireCidr(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    try {
      Cidr.parse(sanitized);
    } catch (InvalidSubnetException ex) {
      throw new IllegalArgumentException(name + " " + ex.getMessage(), ex);
    }
    return sanitized;
  }

  /**
   * Tests whether an exclusion entry can ever match.
   *
   * @param value literal address or CIDR block
   * @return {@code true} when the entry parses
   */
  public static boolean isAddressOrCidr(String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    String trimmed = value.trim();
    return trimmed.indexOf('/') >= 0
        ? Cidr.tryParse(trimmed).isPresent()
        : Cidr.parseAddress(trimmed).isPresent();
  }

  /**
   * Tests host name syntax label by label (ASCII or Punycode); a single trailing dot is allowed.
   *
   * @param host candidate host name
   * @return {@code true} when every label is 1..63 alphanumerics or interior hyphens
   */
  public static boolean isHostname(String host) {
    if (host == null) {
      return false;
    }
    String name = host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
    int len = name.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      return false;
    }
    int start = 0;
    while (true) {
      int dot = name.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      if (!isLabel(name, start, end)) {
        return false;
      }
      if (dot == -1) {
        return true;
      }
      start = dot + 1;
    }
  }

  private static boolean isLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      return false;
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      return false;
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        return false;
      }
    }
    return true;
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
