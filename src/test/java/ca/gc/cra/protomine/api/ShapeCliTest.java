package ca.gc.cra.protomine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ShapeCliTest {
  private static final String TWO_TABLES = """
      Intro.
      {|
      ! A
      ! B
      |-
      | x
      | y
      |}
      Between the tables.
      {|
      | rowspan="2"| a
      | b
      |-
      | c
      |}
      """;

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ShapeCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void drawsSelectedTable() throws IOException {
    Path file = write(TWO_TABLES);

    ExitCode code = ShapeCli.run(new String[] {"in=" + file, "table=2", "columnWidth=2"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.startsWith("Table 2 of 2: 2 columns x 2 rows"));
    assertTrue(output.contains("+─+─+"));
    assertTrue(output.contains("│ +─+"));
  }

  @Test
  void firstTableIsDefault() throws IOException {
    Path file = write(TWO_TABLES);

    ExitCode code = ShapeCli.run(new String[] {"in=" + file});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("Table 1 of 2: 2 columns x 2 rows"));
  }

  @Test
  void tableIndexBeyondCountIsRejected() throws IOException {
    Path file = write(TWO_TABLES);

    ExitCode code = ShapeCli.run(new String[] {"in=" + file, "table=3"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("holds 2 table(s)"));
  }

  @Test
  void cellSizeOutOfRangeIsRejected() throws IOException {
    Path file = write(TWO_TABLES);

    ExitCode code = ShapeCli.run(new String[] {"in=" + file, "rowHeight=1"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: shape"));
  }

  @Test
  void missingInputIsRejected() {
    ExitCode code = ShapeCli.run(new String[] {"table=1"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("in=PATH is required"));
  }

  @Test
  void malformedTableIsFormatError() throws IOException {
    Path file = write("{|\n| rowspan=2| a\n|}\n");

    assertEquals(ExitCode.FORMAT_ERROR, ShapeCli.run(new String[] {"in=" + file}));
  }

  private Path write(String content) throws IOException {
    Path file = tempDir.resolve("tables.wiki");
    Files.writeString(file, content);
    return file;
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
