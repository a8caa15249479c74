package ca.gc.cra.ipscan.infrastructure.persistence;

import ca.gc.cra.ipscan.application.port.ResultStoreConnector;
import ca.gc.cra.ipscan.application.port.ResultStorePort;
import ca.gc.cra.ipscan.domain.address.AddressClass;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Heap-backed result store keeping the latest private and public lists.
 *
 * <p>Backs {@code scan --no-store} runs, where results are counted and printed but never leave the process. Each
 * {@link #open()} returns a session view over the same collections, mirroring one connection per cycle.</p>
 *
 * <p>Thread-safe: collection snapshots are replaced under the instance lock.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryResultStore implements ResultStoreConnector {
  private final Map<AddressClass, List<String>> collections = new EnumMap<>(AddressClass.class);
  private final AtomicInteger opened = new AtomicInteger();
  private final AtomicInteger closed = new AtomicInteger();

  /**
   * Creates an empty store with both collections present and empty.
   */
  public InMemoryResultStore() {
    collections.put(AddressClass.PRIVATE, List.of());
    collections.put(AddressClass.PUBLIC, List.of());
  }

  @Override
  public ResultStorePort open() {
    opened.incrementAndGet();
    return new Session();
  }

  /**
   * Returns the documents currently stored for the class.
   *
   * @param addressClass {@link AddressClass#PRIVATE} or {@link AddressClass#PUBLIC}
   * @return immutable snapshot in insertion order
   */
  public synchronized List<String> addresses(AddressClass addressClass) {
    return collections.getOrDefault(Objects.requireNonNull(addressClass, "addressClass"), List.of());
  }

  /**
   * Number of sessions opened so far.
   *
   * @return open count
   */
  public int openCount() {
    return opened.get();
  }

  /**
   * Number of sessions closed so far.
   *
   * @return close count
   */
  public int closeCount() {
    return closed.get();
  }

  private synchronized void store(AddressClass addressClass, List<String> addresses) {
    collections.put(addressClass, List.copyOf(addresses));
  }

  private final class Session implements ResultStorePort {
    private boolean sessionClosed;

    @Override
    public void replace(AddressClass addressClass, List<String> addresses) {
      Objects.requireNonNull(addresses, "addresses");
      if (addressClass != AddressClass.PRIVATE && addressClass != AddressClass.PUBLIC) {
        throw new IllegalArgumentException(addressClass + " addresses are never persisted");
      }
      if (sessionClosed) {
        throw new IllegalStateException("result store session already closed");
      }
      store(addressClass, addresses);
    }

    @Override
    public void close() {
      if (!sessionClosed) {
        sessionClosed = true;
        closed.incrementAndGet();
      }
    }
  }
}
