package ca.gc.cra.ipscan.validation;

import com.mongodb.ConnectionString;
import com.mongodb.MongoConfigurationException;
import com.mongodb.MongoNamespace;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Validates MongoDB connection strings and namespace names before a client is built.
 * <p><strong>Why:</strong> A typo in {@code storeConnectionURI} would otherwise surface only as a failed ping on every
 * cycle; rejecting it up front turns it into a configuration error.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Parsing is delegated to the driver's {@link ConnectionString}, the same parser the store connector uses,
 * so every string accepted here is one the client accepts. {@code mongodb+srv://} strings trigger the driver's TXT
 * record lookup.
 * @since 0.1.0
 * @see Strings
 */
public final class Net {
  private static final int MAX_URI_LENGTH = 4_096;
  private static final int MAX_DATABASE_NAME_BYTES = 63;
  private static final String SYSTEM_PREFIX = "system.";

  private Net() {
    // Utility
  }

  /**
   * Validates a {@code mongodb://} or {@code mongodb+srv://} connection string.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate connection string
   * @return trimmed connection string
   * @throws IllegalArgumentException when the driver rejects the connection string
   */
  public static String validateStoreUri(String name, String value) {
    String sanitized = Strings.requirePrintableAscii(name, value, MAX_URI_LENGTH);
    try {
      new ConnectionString(sanitized);
    } catch (IllegalArgumentException | MongoConfigurationException ex) {
      throw new IllegalArgumentException(name + " is not a valid MongoDB connection string: " + ex.getMessage(), ex);
    }
    return sanitized;
  }

  /**
   * Validates a database name against the driver's rules, plus the server's 63-byte limit.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate database name
   * @return trimmed database name
   * @throws IllegalArgumentException when the name is blank, too long, or contains characters MongoDB prohibits
   */
  public static String validateDatabaseName(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    if (sanitized.getBytes(StandardCharsets.UTF_8).length > MAX_DATABASE_NAME_BYTES) {
      throw new IllegalArgumentException(name + " must be at most " + MAX_DATABASE_NAME_BYTES + " bytes");
    }
    try {
      MongoNamespace.checkDatabaseNameValidity(sanitized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(name + " is not a valid MongoDB database name: " + ex.getMessage(), ex);
    }
    return sanitized;
  }

  /**
   * Validates a collection name. Any non-blank name is allowed except those with {@code '$'} or the reserved
   * {@code system.} prefix, which the server refuses for user collections.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate collection name
   * @return trimmed collection name
   * @throws IllegalArgumentException when the server would refuse the name
   */
  public static String validateCollectionName(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    if (sanitized.indexOf('$') >= 0) {
      throw new IllegalArgumentException(name + " must not contain '$'");
    }
    if (sanitized.startsWith(SYSTEM_PREFIX)) {
      throw new IllegalArgumentException(name + " must not start with '" + SYSTEM_PREFIX + "'");
    }
    try {
      MongoNamespace.checkCollectionNameValidity(sanitized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(name + " is not a valid MongoDB collection name: " + ex.getMessage(), ex);
    }
    return sanitized;
  }
}
