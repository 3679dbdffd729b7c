package ca.gc.cra.protomine.config;

import ca.gc.cra.protomine.application.extract.PacketAssembler;
import ca.gc.cra.protomine.application.extract.SectionWalker;
import ca.gc.cra.protomine.application.pipeline.ExtractUseCase;
import ca.gc.cra.protomine.application.port.MetricsPort;
import ca.gc.cra.protomine.application.port.PageSource;
import ca.gc.cra.protomine.domain.schema.SchemaInferenceEngine;
import ca.gc.cra.protomine.domain.schema.TypeResolver;
import ca.gc.cra.protomine.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.protomine.infrastructure.source.FilePageSource;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the extraction use case to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate configuration into a runnable pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the inference engine from the configured dialect.</li>
 *   <li>Construct the page source for the configured input.</li>
 *   <li>Share one metrics adapter across the pipeline stages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration references; factory methods create new
 * instances and are not synchronized.</p>
 *
 * @since 0.1.0
 * @see ExtractUseCase
 */
public final class CompositionRoot {
  private final ExtractConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   *
   * @param config extraction configuration; must not be {@code null}
   */
  public CompositionRoot(ExtractConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config extraction configuration; must not be {@code null}
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(ExtractConfig config, MetricsPort metricsPort) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
  }

  /**
   * Builds the extraction pipeline reading pages from the configured input.
   *
   * @return new use case instance
   */
  public ExtractUseCase extractUseCase() {
    return extractUseCase(new FilePageSource(config.input()));
  }

  /**
   * Builds the extraction pipeline reading pages from {@code pageSource}.
   *
   * @param pageSource source of page markup
   * @return new use case instance
   */
  public ExtractUseCase extractUseCase(PageSource pageSource) {
    Objects.requireNonNull(pageSource, "pageSource");
    PacketAssembler assembler = new PacketAssembler(config.dialect(), inferenceEngine(), metrics);
    SectionWalker walker =
        new SectionWalker(config.dialect(), assembler, config.skipMissingTables(), metrics);
    return new ExtractUseCase(pageSource, walker, metrics);
  }

  /**
   * Builds an inference engine honoring the configured marker and nesting limit.
   *
   * @return inference engine that keeps type cells verbatim
   */
  private SchemaInferenceEngine inferenceEngine() {
    DialectConfig dialect = config.dialect();
    return new SchemaInferenceEngine(
        TypeResolver.VERBATIM, dialect.noFieldsMarker(), dialect.maxNestingDepth());
  }
}
