package ca.gc.cra.ipscan.adapter.mongo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import ca.gc.cra.ipscan.application.port.StoreWriteException;
import ca.gc.cra.ipscan.domain.address.AddressClass;
import ca.gc.cra.ipscan.testutil.RecordingMetricsPort;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import java.util.List;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MongoResultStoreAdapterTest {
  @Mock MongoClient client;
  @Mock MongoCollection<Document> privateCollection;
  @Mock MongoCollection<Document> publicCollection;
  @Captor ArgumentCaptor<List<Document>> documents;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private MongoResultStoreAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter = new MongoResultStoreAdapter(
        client, privateCollection, "private_ips", publicCollection, "public_ips", metrics);
  }

  @Test
  void replaceDeletesEverythingThenInsertsOneDocumentPerAddress() throws StoreWriteException {
    when(privateCollection.deleteMany(any(Bson.class))).thenReturn(DeleteResult.acknowledged(4));

    adapter.replace(AddressClass.PRIVATE, List.of("10.0.0.1", "192.168.1.10"));

    InOrder order = inOrder(privateCollection);
    order.verify(privateCollection).deleteMany(new Document());
    order.verify(privateCollection).insertMany(documents.capture());
    assertEquals(
        List.of(new Document("ip", "10.0.0.1"), new Document("ip", "192.168.1.10")),
        documents.getValue());
    verifyNoInteractions(publicCollection);
    assertEquals(List.of(2L), metrics.observed("store.replace.documents"));
  }

  @Test
  void emptyListOnlyClearsCollection() throws StoreWriteException {
    adapter.replace(AddressClass.PUBLIC, List.of());

    verify(publicCollection).deleteMany(new Document());
    verify(publicCollection, never()).insertMany(anyList());
    verifyNoInteractions(privateCollection);
  }

  @Test
  void driverFailureBecomesStoreWriteException() {
    doThrow(new MongoException("not primary")).when(publicCollection).deleteMany(any(Bson.class));

    StoreWriteException ex = assertThrows(
        StoreWriteException.class, () -> adapter.replace(AddressClass.PUBLIC, List.of("8.8.8.8")));

    assertTrue(ex.getMessage().contains("public_ips"));
    assertTrue(ex.getCause() instanceof MongoException);
    assertEquals(1, metrics.count("store.replace.failed"));
  }

  @Test
  void invalidClassIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> adapter.replace(AddressClass.INVALID, List.of("0.0.0.0")));
    verifyNoInteractions(privateCollection, publicCollection);
  }

  @Test
  void closeClosesClientAndToleratesFailure() {
    doThrow(new IllegalStateException("already closed")).when(client).close();

    adapter.close();

    verify(client).close();
  }
}
