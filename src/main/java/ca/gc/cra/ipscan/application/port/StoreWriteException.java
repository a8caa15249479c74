package ca.gc.cra.ipscan.application.port;

/**
 * Checked exception signalling a replace operation was rejected by the result store.
 *
 * @since 0.1.0
 */
public class StoreWriteException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message and cause.
   *
   * @param message diagnostic message naming the collection
   * @param cause underlying driver failure
   */
  public StoreWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
