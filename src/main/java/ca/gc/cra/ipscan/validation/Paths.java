package ca.gc.cra.ipscan.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the scanned log file and the YAML configuration.
 * <p><strong>Why:</strong> Paths arrive as raw strings; null bytes or control characters must be rejected before they
 * reach {@link java.nio.file.Files}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the filesystem at the time of the call.</p>
 *
 * @implNote A missing log file is not a configuration error: the file may appear between cycles, so callers only
 * use {@link #describeInputFile(Path)} for diagnostics.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Converts a raw string into a normalized absolute path after rejecting unsafe characters.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is blank, contains null bytes or control characters, or is not a
   *         valid path for the default filesystem
   */
  public static Path parsePath(String name, String raw) {
    if (raw != null && raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  /**
   * Summarizes the state of an input file for dry-run plans and startup logs.
   *
   * @param file candidate input file
   * @return one of {@code "missing"}, {@code "not a regular file"}, {@code "not readable"}, {@code "empty"} or
   *         {@code "N bytes"}
   */
  public static String describeInputFile(Path file) {
    if (file == null || !Files.exists(file)) {
      return "missing";
    }
    if (!Files.isRegularFile(file)) {
      return "not a regular file";
    }
    if (!Files.isReadable(file)) {
      return "not readable";
    }
    try {
      long size = Files.size(file);
      return size == 0 ? "empty" : size + " bytes";
    } catch (IOException ex) {
      return "unreadable (" + ex.getMessage() + ")";
    }
  }
}
