package ca.gc.cra.ipscan.domain.address;

import java.util.Objects;
import java.util.Set;

/**
 * Per-chunk partition of distinct literals. The three sets are pairwise disjoint.
 *
 * @param privateAddresses literals classified {@link AddressClass#PRIVATE}
 * @param publicAddresses literals classified {@link AddressClass#PUBLIC}
 * @param excludedAddresses literals classified {@link AddressClass#INVALID}
 * @since 0.1.0
 */
public record ChunkResult(
    Set<String> privateAddresses, Set<String> publicAddresses, Set<String> excludedAddresses) {

  public ChunkResult {
    privateAddresses = Set.copyOf(Objects.requireNonNull(privateAddresses, "privateAddresses"));
    publicAddresses = Set.copyOf(Objects.requireNonNull(publicAddresses, "publicAddresses"));
    excludedAddresses = Set.copyOf(Objects.requireNonNull(excludedAddresses, "excludedAddresses"));
  }
}
