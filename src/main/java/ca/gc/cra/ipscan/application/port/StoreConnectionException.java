package ca.gc.cra.ipscan.application.port;

/**
 * Checked exception signalling the result store could not be reached.
 *
 * @since 0.1.0
 */
public class StoreConnectionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message diagnostic message
   */
  public StoreConnectionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message diagnostic message
   * @param cause underlying driver failure
   */
  public StoreConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
