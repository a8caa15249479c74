/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize operator-supplied values.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Security:</strong> {@link ca.gc.cra.ipscan.logging.Logs#redactUri(String)} hides store credentials.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ipscan.logging;
