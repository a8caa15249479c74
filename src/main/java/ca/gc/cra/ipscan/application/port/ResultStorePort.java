package ca.gc.cra.ipscan.application.port;

import ca.gc.cra.ipscan.domain.address.AddressClass;
import java.util.List;

/**
 * <strong>What:</strong> Output port persisting the address lists produced by one scan cycle.
 * <p><strong>Why:</strong> Keeps the cycle independent of the document store driver and lets tests substitute an
 * in-memory store.</p>
 * <p><strong>Role:</strong> Sink side of the hexagon; one instance lives for one cycle.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Replace the full contents of the private or public collection with the supplied literals.</li>
 *   <li>Release the underlying connection on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the single cycle thread; implementations need not synchronize.</p>
 * <p><strong>Observability:</strong> Implementations should emit {@code store.*} metrics and log write failures.</p>
 *
 * @since 0.1.0
 * @see ResultStoreConnector
 */
public interface ResultStorePort extends AutoCloseable {
  /**
   * Deletes every document of the collection mapped to {@code addressClass}, then inserts one document per literal.
   *
   * <p>Readers may observe the collection empty between the delete and the insert. When {@code addresses} is empty
   * the collection is left empty.</p>
   *
   * @param addressClass {@link AddressClass#PRIVATE} or {@link AddressClass#PUBLIC}
   * @param addresses sorted distinct literals; must not be {@code null}
   * @throws StoreWriteException when the delete or insert is rejected
   * @throws IllegalArgumentException when {@code addressClass} is {@link AddressClass#INVALID}
   */
  void replace(AddressClass addressClass, List<String> addresses) throws StoreWriteException;

  /**
   * Closes the store connection.
   */
  @Override
  default void close() {}
}
