package ca.gc.cra.rackd.domain.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates time-ordered 26 character identifiers (ULID layout, Crockford base32).
 *
 * <p>The first 10 characters encode the 48-bit epoch millisecond timestamp; the remaining 16 encode 80 random
 * bits. Identifiers created in later milliseconds sort after earlier ones.</p>
 *
 * @since 0.1.0
 */
public final class Ulids {
  private static final char[] CROCKFORD = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
  private static final int LENGTH = 26;
  private static final int TIME_CHARS = 10;

  private Ulids() {}

  /**
   * Creates an identifier for the supplied timestamp.
   *
   * @param epochMillis creation time in epoch milliseconds
   * @return 26 character identifier
   */
  public static String newUlid(long epochMillis) {
    char[] chars = new char[LENGTH];
    for (int i = TIME_CHARS - 1; i >= 0; i--) {
      chars[i] = CROCKFORD[(int) (epochMillis & 0x1F)];
      epochMillis >>>= 5;
    }

    byte[] randomness = new byte[10];
    ThreadLocalRandom.current().nextBytes(randomness);
    int buffer = 0;
    int bits = 0;
    int out = TIME_CHARS;
    for (byte b : randomness) {
      buffer = (buffer << 8) | (b & 0xFF);
      bits += 8;
      while (bits >= 5) {
        bits -= 5;
        chars[out++] = CROCKFORD[(buffer >> bits) & 0x1F];
      }
    }
    return new String(chars);
  }
}
