/**
 * IPv4 literal extraction and classification.
 * <p><strong>Role:</strong> Pure domain layer with no I/O; scan workers call {@link
 * ca.gc.cra.ipscan.domain.address.ChunkScanner} and {@link ca.gc.cra.ipscan.domain.address.AddressClassifier}
 * concurrently.</p>
 * <p><strong>Concurrency:</strong> Every type is immutable or stateless.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ipscan.domain.address;
