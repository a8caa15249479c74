package ca.gc.cra.ipscan.adapter.mongo;

import ca.gc.cra.ipscan.application.port.MetricsPort;
import ca.gc.cra.ipscan.application.port.ResultStoreConnector;
import ca.gc.cra.ipscan.application.port.ResultStorePort;
import ca.gc.cra.ipscan.application.port.StoreConnectionException;
import ca.gc.cra.ipscan.logging.Logs;
import ca.gc.cra.ipscan.validation.Strings;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.ServerApi;
import com.mongodb.ServerApiVersion;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import java.util.Objects;
import java.util.function.Function;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Opens a MongoDB client per cycle, verifies it with a {@code ping}, and hands back a
 * {@link MongoResultStoreAdapter} over the two result collections.
 * <p><strong>Why:</strong> A fresh connection per cycle keeps the loop independent of long-lived driver state; an
 * unreachable deployment fails the cycle before any file is read.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link ResultStoreConnector}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each {@link #open()} call creates its own client.</p>
 * <p><strong>Observability:</strong> Logs the redacted connection URI; credentials never reach log output.</p>
 *
 * @implNote Clients are created with Stable API version 1.
 * @since 0.1.0
 */
public final class MongoResultStoreConnector implements ResultStoreConnector {
  private static final Logger log = LoggerFactory.getLogger(MongoResultStoreConnector.class);
  private static final String ADMIN_DATABASE = "admin";

  private final String connectionUri;
  private final String databaseName;
  private final String privateCollectionName;
  private final String publicCollectionName;
  private final MetricsPort metrics;
  private final Function<String, MongoClient> clientFactory;

  /**
   * Creates a connector backed by the synchronous MongoDB driver.
   *
   * @param connectionUri MongoDB connection string (e.g., {@code mongodb://mongodb:27017})
   * @param databaseName database holding the result collections
   * @param privateCollectionName collection receiving private addresses
   * @param publicCollectionName collection receiving public addresses
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public MongoResultStoreConnector(
      String connectionUri,
      String databaseName,
      String privateCollectionName,
      String publicCollectionName,
      MetricsPort metrics) {
    this(
        connectionUri,
        databaseName,
        privateCollectionName,
        publicCollectionName,
        metrics,
        MongoResultStoreConnector::createClient);
  }

  MongoResultStoreConnector(
      String connectionUri,
      String databaseName,
      String privateCollectionName,
      String publicCollectionName,
      MetricsPort metrics,
      Function<String, MongoClient> clientFactory) {
    this.connectionUri = Strings.requireNonBlank("storeConnectionURI", connectionUri);
    this.databaseName = Strings.requireNonBlank("databaseName", databaseName);
    this.privateCollectionName = Strings.requireNonBlank("privateCollectionName", privateCollectionName);
    this.publicCollectionName = Strings.requireNonBlank("publicCollectionName", publicCollectionName);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  public ResultStorePort open() throws StoreConnectionException {
    String redacted = Logs.redactUri(connectionUri);
    MongoClient client;
    try {
      client = clientFactory.apply(connectionUri);
    } catch (RuntimeException ex) {
      throw new StoreConnectionException("Unable to create MongoDB client for " + redacted, ex);
    }

    try {
      client.getDatabase(ADMIN_DATABASE).runCommand(new Document("ping", 1));
      log.info("Pinged MongoDB deployment at {}", redacted);
      MongoDatabase database = client.getDatabase(databaseName);
      return new MongoResultStoreAdapter(
          client,
          database.getCollection(privateCollectionName),
          privateCollectionName,
          database.getCollection(publicCollectionName),
          publicCollectionName,
          metrics);
    } catch (RuntimeException ex) {
      closeQuietly(client);
      throw new StoreConnectionException("MongoDB deployment unreachable at " + redacted, ex);
    }
  }

  static MongoClient createClient(String connectionUri) {
    ServerApi serverApi = ServerApi.builder().version(ServerApiVersion.V1).build();
    MongoClientSettings settings = MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(connectionUri))
        .serverApi(serverApi)
        .build();
    return MongoClients.create(settings);
  }

  private static void closeQuietly(MongoClient client) {
    try {
      client.close();
    } catch (RuntimeException closeEx) {
      log.debug("Ignoring MongoDB client close failure after failed ping", closeEx);
    }
  }
}
