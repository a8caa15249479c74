package ca.gc.cra.ipscan.application.port;

/**
 * Opens a verified connection to the result store at the start of each scan cycle.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ResultStoreConnector {
  /**
   * Connects and checks the store is reachable.
   *
   * @return open store; caller closes it when the cycle ends
   * @throws StoreConnectionException when the store cannot be reached or rejects the liveness check
   */
  ResultStorePort open() throws StoreConnectionException;
}
