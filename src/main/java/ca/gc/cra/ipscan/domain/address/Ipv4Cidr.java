package ca.gc.cra.ipscan.domain.address;

/**
 * Immutable IPv4 network block such as {@code 172.16.0.0/12}.
 *
 * <p>The network address is normalized on construction so host bits never leak into comparisons.</p>
 *
 * @param network packed network address with host bits cleared
 * @param prefixLength number of leading network bits (0-32)
 * @since 0.1.0
 */
public record Ipv4Cidr(int network, int prefixLength) {

  /**
   * Validates the prefix length and clears host bits from the network address.
   *
   * @throws IllegalArgumentException when {@code prefixLength} is outside 0-32
   */
  public Ipv4Cidr {
    if (prefixLength < 0 || prefixLength > 32) {
      throw new IllegalArgumentException("prefixLength must be between 0 and 32 (was " + prefixLength + ")");
    }
    network = network & mask(prefixLength);
  }

  /**
   * Parses CIDR notation ({@code a.b.c.d/n}).
   *
   * @param notation CIDR text; must not be {@code null}
   * @return parsed block
   * @throws IllegalArgumentException when the notation is malformed
   */
  public static Ipv4Cidr parse(String notation) {
    if (notation == null) {
      throw new IllegalArgumentException("cidr must not be null");
    }
    int slash = notation.indexOf('/');
    if (slash <= 0 || slash == notation.length() - 1) {
      throw new IllegalArgumentException("cidr must look like a.b.c.d/n (was '" + notation + "')");
    }
    int address = Ipv4Addresses.parse(notation.substring(0, slash).trim())
        .orElseThrow(() -> new IllegalArgumentException("cidr has malformed address: " + notation));
    int prefix;
    try {
      prefix = Integer.parseInt(notation.substring(slash + 1).trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("cidr has malformed prefix: " + notation, ex);
    }
    return new Ipv4Cidr(address, prefix);
  }

  /**
   * Tests whether the packed address lies within this block.
   *
   * @param address packed IPv4 address
   * @return {@code true} when the network bits match
   */
  public boolean contains(int address) {
    return (address & mask(prefixLength)) == network;
  }

  @Override
  public String toString() {
    return Ipv4Addresses.format(network) + "/" + prefixLength;
  }

  private static int mask(int prefixLength) {
    return prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
  }
}
