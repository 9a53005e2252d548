package ca.gc.cra.rackd.domain.net;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parsed IPv4 or IPv6 CIDR block.
 * <p><strong>Why:</strong> Subnet enumeration and exclusion matching need the masked network, the broadcast
 * address and a containment test without touching DNS.</p>
 * <p><strong>Role:</strong> Domain value object.</p>
 * <p><strong>Thread-safety:</strong> Immutable; byte arrays are copied on the way in and out.</p>
 *
 * @implNote Only address literals are accepted; host names are rejected so parsing never blocks on resolution.
 * @since 0.1.0
 */
public final class Cidr {
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern IPV6_CHARS = Pattern.compile("\\A[0-9A-Fa-f:.]+\\z");

  private final byte[] network;
  private final byte[] mask;
  private final int prefixLength;

  private Cidr(byte[] network, byte[] mask, int prefixLength) {
    this.network = network;
    this.mask = mask;
    this.prefixLength = prefixLength;
  }

  /**
   * Parses {@code address/prefix} notation and masks the address to its network.
   *
   * @param value CIDR text such as {@code 192.168.1.0/24} or {@code 2001:db8::/64}
   * @return parsed block
   * @throws InvalidSubnetException when the address or prefix is malformed or out of range
   */
  public static Cidr parse(String value) throws InvalidSubnetException {
    if (value == null || value.isBlank()) {
      throw new InvalidSubnetException("invalid CIDR address: <blank>");
    }
    String trimmed = value.trim();
    int slash = trimmed.indexOf('/');
    if (slash <= 0 || slash == trimmed.length() - 1) {
      throw new InvalidSubnetException("invalid CIDR address: " + value);
    }
    byte[] address = parseAddress(trimmed.substring(0, slash))
        .orElseThrow(() -> new InvalidSubnetException("invalid CIDR address: " + value));
    String prefixText = trimmed.substring(slash + 1);
    int bits = address.length * 8;
    int prefix;
    try {
      prefix = Integer.parseInt(prefixText);
    } catch (NumberFormatException ex) {
      throw new InvalidSubnetException("invalid CIDR address: " + value);
    }
    if (prefix < 0 || prefix > bits || !prefixText.chars().allMatch(Character::isDigit)) {
      throw new InvalidSubnetException("invalid CIDR address: " + value);
    }
    byte[] mask = maskOf(address.length, prefix);
    byte[] network = new byte[address.length];
    for (int i = 0; i < address.length; i++) {
      network[i] = (byte) (address[i] & mask[i]);
    }
    return new Cidr(network, mask, prefix);
  }

  /**
   * Parses a CIDR block, returning empty instead of throwing.
   *
   * @param value candidate CIDR text
   * @return parsed block or empty when malformed
   */
  public static Optional<Cidr> tryParse(String value) {
    try {
      return Optional.of(parse(value));
    } catch (InvalidSubnetException ex) {
      return Optional.empty();
    }
  }

  /**
   * Parses an IPv4 dotted quad or IPv6 literal into its raw bytes.
   *
   * @param literal address text; host names are rejected
   * @return 4 or 16 address bytes, or empty when the text is not an address literal
   */
  public static Optional<byte[]> parseAddress(String literal) {
    if (literal == null) {
      return Optional.empty();
    }
    String text = literal.trim();
    if (IPV4_PATTERN.matcher(text).matches()) {
      String[] parts = text.split("\\.");
      byte[] bytes = new byte[4];
      for (int i = 0; i < 4; i++) {
        int octet = Integer.parseInt(parts[i]);
        if (octet > 255) {
          return Optional.empty();
        }
        bytes[i] = (byte) octet;
      }
      return Optional.of(bytes);
    }
    if (text.indexOf(':') >= 0 && IPV6_CHARS.matcher(text).matches()) {
      try {
        // Literal containing ':' is parsed locally by the JDK; no lookup is performed.
        byte[] bytes = InetAddress.getByName(text).getAddress();
        return Optional.of(bytes);
      } catch (UnknownHostException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  /**
   * Formats raw address bytes as text.
   *
   * @param address 4 or 16 address bytes
   * @return dotted quad or IPv6 text
   * @throws IllegalArgumentException when the length is neither 4 nor 16
   */
  public static String format(byte[] address) {
    try {
      return InetAddress.getByAddress(address).getHostAddress();
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("address must be 4 or 16 bytes (was " + address.length + ")", ex);
    }
  }

  /**
   * Tests whether an address lies inside this block.
   *
   * @param address raw address bytes
   * @return {@code true} when the address family matches and the masked address equals the network
   */
  public boolean contains(byte[] address) {
    if (address == null || address.length != network.length) {
      return false;
    }
    for (int i = 0; i < network.length; i++) {
      if ((address[i] & mask[i]) != network[i]) {
        return false;
      }
    }
    return true;
  }

  /**
   * Tests whether a textual address lies inside this block.
   *
   * @param literal address text
   * @return {@code false} for malformed text
   */
  public boolean contains(String literal) {
    return parseAddress(literal).map(this::contains).orElse(false);
  }

  /** @return copy of the masked network address */
  public byte[] network() {
    return network.clone();
  }

  /** @return copy of the network OR'ed with the inverted mask */
  public byte[] broadcast() {
    byte[] broadcast = new byte[network.length];
    for (int i = 0; i < network.length; i++) {
      broadcast[i] = (byte) (network[i] | ~mask[i]);
    }
    return broadcast;
  }

  /** @return prefix length in bits */
  public int prefixLength() {
    return prefixLength;
  }

  /** @return 32 for IPv4 blocks, 128 for IPv6 blocks */
  public int addressBits() {
    return network.length * 8;
  }

  /** @return number of addresses in the block, network and broadcast included */
  public BigInteger size() {
    return BigInteger.ONE.shiftLeft(addressBits() - prefixLength);
  }

  private static byte[] maskOf(int length, int prefix) {
    byte[] mask = new byte[length];
    int remaining = prefix;
    for (int i = 0; i < length && remaining > 0; i++) {
      int bits = Math.min(8, remaining);
      mask[i] = (byte) (0xFF << (8 - bits));
      remaining -= bits;
    }
    return mask;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Cidr other)) {
      return false;
    }
    return prefixLength == other.prefixLength && Arrays.equals(network, other.network);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(network) + prefixLength;
  }

  @Override
  public String toString() {
    return format(network) + "/" + prefixLength;
  }
}
