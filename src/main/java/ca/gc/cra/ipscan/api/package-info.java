/**
 * CLI entry points for the {@code run} service loop and the one-shot {@code scan} command.
 * <p><strong>Role:</strong> Adapter layer on the driving side; resolves configuration, configures logging and
 * metrics, and invokes the scan cycle.</p>
 * <p><strong>Security:</strong> Connection strings are validated and logged with credentials redacted.</p>
 */
package ca.gc.cra.ipscan.api;
