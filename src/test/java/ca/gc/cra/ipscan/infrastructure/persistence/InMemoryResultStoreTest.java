package ca.gc.cra.ipscan.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.ipscan.application.port.ResultStorePort;
import ca.gc.cra.ipscan.domain.address.AddressClass;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryResultStoreTest {

  @Test
  void replaceOverwritesPreviousContents() throws Exception {
    InMemoryResultStore store = new InMemoryResultStore();

    try (ResultStorePort session = store.open()) {
      session.replace(AddressClass.PRIVATE, List.of("10.0.0.1", "10.0.0.2"));
      session.replace(AddressClass.PRIVATE, List.of("10.0.0.3"));
    }

    assertEquals(List.of("10.0.0.3"), store.addresses(AddressClass.PRIVATE));
    assertEquals(List.of(), store.addresses(AddressClass.PUBLIC));
    assertEquals(1, store.openCount());
    assertEquals(1, store.closeCount());
  }

  @Test
  void closedSessionAndInvalidClassAreRejected() {
    InMemoryResultStore store = new InMemoryResultStore();
    ResultStorePort session = store.open();

    assertThrows(IllegalArgumentException.class, () -> session.replace(AddressClass.INVALID, List.of()));
    session.close();
    session.close();

    assertThrows(IllegalStateException.class, () -> session.replace(AddressClass.PUBLIC, List.of("8.8.8.8")));
    assertEquals(1, store.closeCount());
  }
}
