package ca.gc.cra.ipscan.domain.address;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Assigns each candidate literal to {@link AddressClass#PRIVATE}, {@link AddressClass#PUBLIC}
 * or {@link AddressClass#INVALID}.
 * <p><strong>Why:</strong> Scan workers partition matches without touching shared state, so classification must be a
 * pure function of the candidate and the injected {@link ClassificationRules}.</p>
 * <p><strong>Role:</strong> Domain service invoked inside extraction workers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; one instance is shared by every worker.</p>
 * <p><strong>Performance:</strong> O(number of ranges) mask comparisons per candidate.</p>
 *
 * @implNote Loopback (127.0.0.0/8) and link-local (169.254.0.0/16) are neither private nor excluded, so they land in
 * {@link AddressClass#PUBLIC}. Downstream consumers rely on that split.
 * @since 0.1.0
 */
public final class AddressClassifier {
  private final List<Ipv4Cidr> privateRanges;
  private final List<Ipv4Cidr> excludedRanges;

  /**
   * Creates a classifier backed by the supplied rules.
   *
   * @param rules range tables; must not be {@code null}
   */
  public AddressClassifier(ClassificationRules rules) {
    Objects.requireNonNull(rules, "rules");
    this.privateRanges = rules.privateRanges();
    this.excludedRanges = rules.excludedRanges();
  }

  /**
   * Classifies a candidate literal. Never throws.
   *
   * @param candidate dotted-quad text; {@code null} or malformed input yields {@link AddressClass#INVALID}
   * @return classification bucket
   */
  public AddressClass classify(String candidate) {
    OptionalInt parsed = Ipv4Addresses.parse(candidate);
    if (parsed.isEmpty()) {
      return AddressClass.INVALID;
    }
    int address = parsed.getAsInt();
    if (matchesAny(excludedRanges, address)) {
      return AddressClass.INVALID;
    }
    return matchesAny(privateRanges, address) ? AddressClass.PRIVATE : AddressClass.PUBLIC;
  }

  private static boolean matchesAny(List<Ipv4Cidr> ranges, int address) {
    for (Ipv4Cidr range : ranges) {
      if (range.contains(address)) {
        return true;
      }
    }
    return false;
  }
}
