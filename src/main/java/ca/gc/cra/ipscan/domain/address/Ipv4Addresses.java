package ca.gc.cra.ipscan.domain.address;

import java.util.OptionalInt;

/**
 * <strong>What:</strong> Parses dotted-quad IPv4 text into its 32-bit representation.
 * <p><strong>Why:</strong> Range checks against CIDR blocks are simple mask comparisons once the address is an
 * {@code int}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single pass over at most 15 characters; no allocation on success besides the
 * {@link OptionalInt}.</p>
 *
 * @implNote Groups may carry leading zeros ({@code 010} parses as 10). Octal interpretation is never applied.
 * @since 0.1.0
 */
public final class Ipv4Addresses {
  private static final int MAX_TEXT_LENGTH = 15;

  private Ipv4Addresses() {
    // Utility
  }

  /**
   * Parses four dot-separated decimal groups of one to three ASCII digits, each within 0-255.
   *
   * @param text candidate literal; {@code null} is treated as malformed
   * @return packed address, or empty when the text is not a dotted-quad IPv4 literal
   */
  public static OptionalInt parse(String text) {
    if (text == null || text.isEmpty() || text.length() > MAX_TEXT_LENGTH) {
      return OptionalInt.empty();
    }
    int address = 0;
    int octets = 0;
    int value = 0;
    int digits = 0;
    for (int i = 0; i <= text.length(); i++) {
      char c = i == text.length() ? '.' : text.charAt(i);
      if (c == '.') {
        if (digits == 0 || value > 255) {
          return OptionalInt.empty();
        }
        address = (address << 8) | value;
        octets++;
        value = 0;
        digits = 0;
        continue;
      }
      if (c < '0' || c > '9' || digits == 3) {
        return OptionalInt.empty();
      }
      value = value * 10 + (c - '0');
      digits++;
    }
    return octets == 4 ? OptionalInt.of(address) : OptionalInt.empty();
  }

  /**
   * Formats a packed address as canonical dotted-quad text.
   *
   * @param address packed IPv4 address
   * @return dotted-quad representation without leading zeros
   */
  public static String format(int address) {
    return ((address >>> 24) & 0xFF) + "."
        + ((address >>> 16) & 0xFF) + "."
        + ((address >>> 8) & 0xFF) + "."
        + (address & 0xFF);
  }
}
