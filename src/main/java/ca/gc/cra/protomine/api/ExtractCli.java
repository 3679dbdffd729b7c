package ca.gc.cra.protomine.api;

import ca.gc.cra.protomine.application.extract.ExtractionResult;
import ca.gc.cra.protomine.application.extract.SkippedPacket;
import ca.gc.cra.protomine.application.pipeline.ExtractUseCase;
import ca.gc.cra.protomine.config.CompositionRoot;
import ca.gc.cra.protomine.config.ExtractConfig;
import ca.gc.cra.protomine.domain.DialectException;
import ca.gc.cra.protomine.domain.ProtomineException;
import ca.gc.cra.protomine.domain.packet.Packet;
import ca.gc.cra.protomine.domain.schema.SchemaRenderer;
import ca.gc.cra.protomine.domain.table.TableFormatException;
import ca.gc.cra.protomine.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.protomine.logging.LoggingConfigurator;
import ca.gc.cra.protomine.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for extracting packet schemas from a saved protocol page.
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String MODE = "extract";
  private static final String SUMMARY_USAGE =
      "usage: extract in=PATH [revision=ID] [config=PATH] [--skip-missing-tables] [--print-schema] "
          + "[--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      protomine extract

      Usage:
        extract in=./pages revision=2772944 [options]

      Required:
        in=PATH                  Page file, or directory of <revision>.wiki files

      Optional (validated):
        revision=ID              Page revision to read; required when in= is a directory
        config=PATH              YAML file with common/extract sections
        dialect.states=A,B       Top-level sections holding packets
        dialect.ignored=A,B      Top-level sections to skip
        dialect.directions=A,B   Allowed direction subsections
        dialect.maxNestingDepth=N  Maximum composite nesting (default 16)
        --skip-missing-tables    Record packets without a table as skipped instead of failing
        --print-schema           Print each packet's field tree
        --dry-run                Validate inputs and print plan without extracting
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ExtractCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the extract CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for extract CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--skip-missing-tables")) {
      kv.put("skipMissingTables", "true");
    }
    if (input.hasFlag("--print-schema")) {
      kv.put("printSchema", "true");
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    ExtractConfig config;
    Path inputPath;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = ExtractConfig.fromMap(configInputs);
      inputPath = Paths.requireReadable("in", config.input());
      if (Files.isDirectory(inputPath) && config.revision().isEmpty()) {
        throw new IllegalArgumentException("revision is required when in= is a directory");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, inputPath);
      return ExitCode.SUCCESS;
    }

    long revision = config.revision().orElse(0L);
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      ExtractUseCase useCase = new CompositionRoot(config, metrics).extractUseCase();
      log.info("Configured extract pipeline: input={}, revision={}, skipMissingTables={}",
          inputPath, revision, config.skipMissingTables());
      ExtractionResult result = useCase.run(revision);
      printResult(result, config.printSchema());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read page from {}", inputPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Extract configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (DialectException ex) {
      log.error("Page layout not recognized in section {}: {}", ex.sectionName(), ex.getMessage());
      return ExitCode.DIALECT_ERROR;
    } catch (TableFormatException ex) {
      log.error("Malformed table markup: {}", ex.getMessage());
      return ExitCode.FORMAT_ERROR;
    } catch (ProtomineException ex) {
      log.error("Extraction failed: {}", ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in extract pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printResult(ExtractionResult result, boolean printSchema) {
    CliPrinter.println("Extracted " + result.packetCount() + " packets ("
        + result.skipped().size() + " skipped)");
    result.packets().forEach((state, directions) -> directions.forEach((direction, packets) ->
        CliPrinter.println(" " + state + "/" + direction + ": " + packets.size() + " packets")));
    for (SkippedPacket skipped : result.skipped()) {
      CliPrinter.println(" skipped " + skipped.state() + "/" + skipped.direction() + "/"
          + skipped.name() + ": " + skipped.reason());
    }
    if (!printSchema) {
      return;
    }
    result.packets().forEach((state, directions) -> directions.forEach((direction, packets) ->
        printPackets(state, direction, packets)));
  }

  private static void printPackets(String state, String direction, List<Packet> packets) {
    for (Packet packet : packets) {
      CliPrinter.println("");
      CliPrinter.println(state + "/" + direction + " " + packet.name() + " [" + packet.protocolId()
          + packet.resourceId().map(resource -> " " + resource).orElse("") + "]");
      CliPrinter.println(SchemaRenderer.render(packet.fields()));
    }
  }

  private static void printDryRunPlan(ExtractConfig config, Path inputPath) {
    CliPrinter.printLines(
        "Extract dry-run: no page will be parsed.",
        " Input             : " + inputPath,
        " Revision          : " + (config.revision().isPresent() ? config.revision().getAsLong() : "<file>"),
        " States            : " + String.join(",", config.dialect().states()),
        " Ignored sections  : " + String.join(",", config.dialect().ignoredSections()),
        " Directions        : " + String.join(",", config.dialect().directions()),
        " Max nesting depth : " + config.dialect().maxNestingDepth(),
        " Skip missing table: " + config.skipMissingTables(),
        " Print schema      : " + config.printSchema(),
        " Re-run without --dry-run to extract packets.");
  }
}
