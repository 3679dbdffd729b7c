package ca.gc.cra.protomine.api;

import ca.gc.cra.protomine.domain.table.Grid;
import ca.gc.cra.protomine.domain.table.GridShapeRenderer;
import ca.gc.cra.protomine.domain.table.TableFormatException;
import ca.gc.cra.protomine.domain.table.WikiTableParser;
import ca.gc.cra.protomine.logging.LoggingConfigurator;
import ca.gc.cra.protomine.validation.Numbers;
import ca.gc.cra.protomine.validation.Paths;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the cell outline of one table in a markup file, for checking how merged cells were placed.
 *
 * @since 0.1.0
 */
public final class ShapeCli {
  private static final Logger log = LoggerFactory.getLogger(ShapeCli.class);
  private static final String MODE = "shape";
  private static final String SUMMARY_USAGE =
      "usage: shape in=PATH [table=N] [columnWidth=N] [rowHeight=N] [config=PATH]";
  private static final String HELP_TEXT = """
      protomine shape

      Usage:
        shape in=./packet.wiki table=2

      Required:
        in=PATH           Markup file holding one or more tables

      Optional (validated):
        table=N           1-based index of the table to draw (default 1)
        columnWidth=N     Characters per grid column (default 5)
        rowHeight=N       Lines per grid row (default 2)
        config=PATH       YAML file with common/shape sections
        --verbose         Enable DEBUG logging
        --help            Show this message
      """;
  private static final int MAX_CELL_SIZE = 40;

  private ShapeCli() {}

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
   * Executes the shape CLI logic.
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
    }

    Path file;
    int tableIndex;
    GridShapeRenderer renderer;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, kv, log::warn);
      String in = effective.get("in");
      if (in == null || in.isBlank()) {
        throw new IllegalArgumentException("in=PATH is required");
      }
      file = Paths.requireReadableFile("in", Path.of(in.trim()));
      tableIndex = Numbers.parseInt("table", effective.get("table"), 1, Integer.MAX_VALUE);
      renderer = new GridShapeRenderer(
          Numbers.parseInt("columnWidth", effective.get("columnWidth"), 2, MAX_CELL_SIZE),
          Numbers.parseInt("rowHeight", effective.get("rowHeight"), 2, MAX_CELL_SIZE));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid shape arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    List<Grid> tables;
    try {
      tables = WikiTableParser.parseAll(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException ex) {
      log.error("Unable to read markup from {}", file, ex);
      return ExitCode.IO_ERROR;
    } catch (TableFormatException ex) {
      log.error("Malformed table markup in {}: {}", file, ex.getMessage());
      return ExitCode.FORMAT_ERROR;
    }

    if (tableIndex > tables.size()) {
      log.error("{} holds {} table(s); table={} does not exist", file, tables.size(), tableIndex);
      return ExitCode.INVALID_ARGS;
    }
    Grid grid = tables.get(tableIndex - 1);
    CliPrinter.println("Table " + tableIndex + " of " + tables.size() + ": "
        + grid.width() + " columns x " + grid.height() + " rows");
    CliPrinter.println(renderer.render(grid));
    return ExitCode.SUCCESS;
  }
}
