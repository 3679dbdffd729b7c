package ca.gc.cra.protomine.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the extraction pipeline.
 * <p><strong>Why:</strong> Lets the pipeline count parsed and skipped packets without binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code extract.packets.parsed}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code extract.packets.skipped.symmetry}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, field counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates; useful for tests.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
