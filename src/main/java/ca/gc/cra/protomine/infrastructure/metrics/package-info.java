/**
 * Metrics adapter bridging the extraction pipeline's {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code extract.*} namespace.</p>
 * <p><strong>Security:</strong> Only counts and latencies are exported; page content never is.</p>
 */
package ca.gc.cra.protomine.infrastructure.metrics;
