package ca.gc.cra.ipscan.domain.address;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Deduplicated, lexicographically sorted output of one extraction run.
 * <p><strong>Role:</strong> Value handed from the extraction pipeline to the result store.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param privateAddresses sorted private literals
 * @param publicAddresses sorted public literals
 * @param excludedAddresses sorted literals that matched the pattern but were classified invalid; never persisted
 * @implNote Ordering is {@link String#compareTo(String)}, so {@code 10.0.0.10} sorts before {@code 10.0.0.2}.
 * @since 0.1.0
 */
public record ExtractionResult(
    List<String> privateAddresses, List<String> publicAddresses, List<String> excludedAddresses) {
  private static final ExtractionResult EMPTY = new ExtractionResult(List.of(), List.of(), List.of());

  public ExtractionResult {
    privateAddresses = List.copyOf(Objects.requireNonNull(privateAddresses, "privateAddresses"));
    publicAddresses = List.copyOf(Objects.requireNonNull(publicAddresses, "publicAddresses"));
    excludedAddresses = List.copyOf(Objects.requireNonNull(excludedAddresses, "excludedAddresses"));
  }

  /**
   * Result reported when the input is unusable or processing failed.
   *
   * @return shared empty result
   */
  public static ExtractionResult empty() {
    return EMPTY;
  }

  /**
   * Sorts the merged sets into an immutable result.
   *
   * @param privateAddresses distinct private literals
   * @param publicAddresses distinct public literals
   * @param excludedAddresses distinct excluded literals
   * @return sorted result
   */
  public static ExtractionResult sorted(
      Collection<String> privateAddresses,
      Collection<String> publicAddresses,
      Collection<String> excludedAddresses) {
    return new ExtractionResult(
        sortedCopy(privateAddresses), sortedCopy(publicAddresses), sortedCopy(excludedAddresses));
  }

  /**
   * Returns the list stored for the given class.
   *
   * @param addressClass bucket to read
   * @return sorted literals; {@link AddressClass#INVALID} returns the excluded list
   */
  public List<String> addresses(AddressClass addressClass) {
    return switch (Objects.requireNonNull(addressClass, "addressClass")) {
      case PRIVATE -> privateAddresses;
      case PUBLIC -> publicAddresses;
      case INVALID -> excludedAddresses;
    };
  }

  /**
   * Indicates whether no literal was retained in any bucket.
   *
   * @return {@code true} when all three lists are empty
   */
  public boolean isEmpty() {
    return privateAddresses.isEmpty() && publicAddresses.isEmpty() && excludedAddresses.isEmpty();
  }

  private static List<String> sortedCopy(Collection<String> source) {
    List<String> copy = new ArrayList<>(Objects.requireNonNull(source, "source"));
    Collections.sort(copy);
    return copy;
  }
}
