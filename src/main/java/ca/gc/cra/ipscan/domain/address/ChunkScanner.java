package ca.gc.cra.ipscan.domain.address;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Extracts the distinct IPv4 literals contained in a raw byte chunk.
 * <p><strong>Why:</strong> Log files are read as opaque bytes; decoding must never fail on binary noise or mixed
 * encodings.</p>
 * <p><strong>Role:</strong> Domain service executed by extraction workers, one chunk per call.</p>
 * <p><strong>Thread-safety:</strong> Holds only an immutable {@link Pattern}; each call creates its own
 * {@link Matcher}.</p>
 * <p><strong>Performance:</strong> Linear in chunk length; the ISO-8859-1 view costs one char per byte.</p>
 *
 * @implNote Bytes map one-to-one onto ISO-8859-1 characters, so non-ASCII bytes become non-word characters that
 * separate candidates instead of joining them. Word boundaries are ASCII-only lookarounds, which keeps
 * {@code 1.2.3.4.5} yielding {@code 1.2.3.4} while {@code a1.2.3.4} yields nothing.
 * @since 0.1.0
 */
public final class ChunkScanner {
  private static final String OCTET = "(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)";
  private static final String IPV4_REGEX =
      "(?<![A-Za-z0-9_])(?:" + OCTET + "\\.){3}" + OCTET + "(?![A-Za-z0-9_])";

  private final Pattern pattern;

  /**
   * Creates a scanner around a precompiled literal pattern.
   *
   * @param pattern compiled IPv4 literal pattern, usually {@link #defaultPattern()}
   */
  public ChunkScanner(Pattern pattern) {
    this.pattern = Objects.requireNonNull(pattern, "pattern");
  }

  /**
   * Compiles the standard dotted-quad pattern with ASCII word boundaries.
   *
   * @return compiled pattern; callers should build it once and share it
   */
  public static Pattern defaultPattern() {
    return Pattern.compile(IPV4_REGEX);
  }

  /**
   * Scans a whole chunk.
   *
   * @param chunk raw bytes; must not be {@code null}
   * @return distinct matches in first-seen order
   */
  public Set<String> scan(byte[] chunk) {
    Objects.requireNonNull(chunk, "chunk");
    return scan(chunk, 0, chunk.length);
  }

  /**
   * Scans {@code length} bytes of {@code data} starting at {@code offset}.
   *
   * @param data source buffer; must not be {@code null}
   * @param offset first byte to scan
   * @param length number of bytes to scan
   * @return distinct matches in first-seen order
   * @throws IndexOutOfBoundsException when the range falls outside {@code data}
   */
  public Set<String> scan(byte[] data, int offset, int length) {
    Objects.requireNonNull(data, "data");
    Objects.checkFromIndexSize(offset, length, data.length);
    Set<String> found = new LinkedHashSet<>();
    if (length == 0) {
      return found;
    }
    String text = new String(data, offset, length, StandardCharsets.ISO_8859_1);
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      found.add(matcher.group());
    }
    return found;
  }
}
