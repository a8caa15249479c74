package ca.gc.cra.ipscan.domain.address;

/**
 * Classification bucket assigned to an extracted IPv4 literal.
 *
 * @since 0.1.0
 */
public enum AddressClass {
  /** Address inside one of the RFC1918 private ranges. */
  PRIVATE,
  /** Well-formed address outside the private and excluded ranges. */
  PUBLIC,
  /** Malformed candidate, or an address in an excluded range (unspecified, multicast, reserved). */
  INVALID
}
