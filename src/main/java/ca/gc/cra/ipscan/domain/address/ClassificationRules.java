package ca.gc.cra.ipscan.domain.address;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable range tables driving {@link AddressClassifier}.
 * <p><strong>Role:</strong> Domain configuration built once at startup and handed to the classifier.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across scan workers.</p>
 *
 * @param privateRanges blocks classified as {@link AddressClass#PRIVATE}
 * @param excludedRanges blocks classified as {@link AddressClass#INVALID} even though well-formed
 * @since 0.1.0
 */
public record ClassificationRules(List<Ipv4Cidr> privateRanges, List<Ipv4Cidr> excludedRanges) {

  /**
   * Copies both range lists.
   */
  public ClassificationRules {
    privateRanges = List.copyOf(Objects.requireNonNull(privateRanges, "privateRanges"));
    excludedRanges = List.copyOf(Objects.requireNonNull(excludedRanges, "excludedRanges"));
  }

  /**
   * RFC1918 private blocks plus the unspecified, multicast and reserved exclusions.
   *
   * @return default rules
   */
  public static ClassificationRules defaults() {
    return new ClassificationRules(
        List.of(
            Ipv4Cidr.parse("10.0.0.0/8"),
            Ipv4Cidr.parse("172.16.0.0/12"),
            Ipv4Cidr.parse("192.168.0.0/16")),
        List.of(
            Ipv4Cidr.parse("0.0.0.0/32"),
            Ipv4Cidr.parse("224.0.0.0/4"),
            Ipv4Cidr.parse("240.0.0.0/4")));
  }
}
