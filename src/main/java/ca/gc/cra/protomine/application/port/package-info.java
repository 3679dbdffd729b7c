/**
 * <strong>Purpose:</strong> Ports the extraction pipeline depends on: the page source and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.protomine.application.port;
