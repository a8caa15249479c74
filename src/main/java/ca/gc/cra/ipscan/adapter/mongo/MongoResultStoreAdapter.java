package ca.gc.cra.ipscan.adapter.mongo;

import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.application.port.ResultStorePort;
import ca.gc.cra.ipscan.application.port.StoreWriteException;
import ca.gc.cra.ipscan.domain.address.AddressClass;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.result.DeleteResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> MongoDB implementation of {@link ResultStorePort} storing one {@code {ip: "..."}} document per
 * literal.
 * <p><strong>Role:</strong> Sink-side adapter created by {@link MongoResultStoreConnector} for a single cycle.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map {@link AddressClass#PRIVATE} and {@link AddressClass#PUBLIC} to their collections.</li>
 *   <li>Replace a collection with {@code deleteMany({})} followed by one {@code insertMany}.</li>
 *   <li>Close the owning {@link MongoClient} when the cycle ends.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Used from the cycle thread only; the driver objects are thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code store.replace.documents} and {@code store.replace.failed}.</p>
 *
 * @implNote The replace is not atomic. Readers may observe an empty collection between the delete and the insert.
 * @since 0.1.0
 * @see MongoResultStoreConnector
 */
public final class MongoResultStoreAdapter implements ResultStorePort {
  private static final Logger log = LoggerFactory.getLogger(MongoResultStoreAdapter.class);
  static final String IP_FIELD = "ip";

  private final MongoClient client;
  private final NamedCollection privateCollection;
  private final NamedCollection publicCollection;
  private final MetricsPort metrics;

  MongoResultStoreAdapter(
      MongoClient client,
      MongoCollection<Document> privateCollection,
      String privateName,
      MongoCollection<Document> publicCollection,
      String publicName,
      MetricsPort metrics) {
    this.client = Objects.requireNonNull(client, "client");
    this.privateCollection = new NamedCollection(
        Objects.requireNonNull(privateCollection, "privateCollection"), privateName);
    this.publicCollection = new NamedCollection(
        Objects.requireNonNull(publicCollection, "publicCollection"), publicName);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void replace(AddressClass addressClass, List<String> addresses) throws StoreWriteException {
    Objects.requireNonNull(addresses, "addresses");
    NamedCollection target = collectionFor(addressClass);
    try {
      DeleteResult deleted = target.collection().deleteMany(new Document());
      if (!addresses.isEmpty()) {
        List<Document> documents = new ArrayList<>(addresses.size());
        for (String address : addresses) {
          documents.add(new Document(IP_FIELD, address));
        }
        target.collection().insertMany(documents);
      }
      metrics.observe("store.replace.documents", addresses.size());
      log.debug(
          "Replaced collection {}: removed {}, inserted {}",
          target.name(),
          deleted == null ? "?" : deleted.getDeletedCount(),
          addresses.size());
    } catch (MongoException ex) {
      metrics.increment("store.replace.failed");
      throw new StoreWriteException("Failed to replace collection " + target.name(), ex);
    }
  }

  @Override
  public void close() {
    try {
      client.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close MongoDB client cleanly", ex);
    }
  }

  private NamedCollection collectionFor(AddressClass addressClass) {
    return switch (Objects.requireNonNull(addressClass, "addressClass")) {
      case PRIVATE -> privateCollection;
      case PUBLIC -> publicCollection;
      case INVALID -> throw new IllegalArgumentException("INVALID addresses are never persisted");
    };
  }

  private record NamedCollection(MongoCollection<Document> collection, String name) {}
}
