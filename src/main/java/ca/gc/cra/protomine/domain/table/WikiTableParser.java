package ca.gc.cra.protomine.domain.table;

import ca.gc.cra.protomine.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stateless parser that rebuilds the spanning-cell grid of a wiki table.
 *
 * <p>Input is processed one line at a time:</p>
 * <ul>
 *   <li>{@code |-} with no space between the tokens closes the current row and prunes spans that no
 *       longer reach the next row;</li>
 *   <li>{@code !} and {@code |} start a header or data cell after skipping columns still occupied
 *       by cells merged down from earlier rows;</li>
 *   <li>any other non-blank line continues the content of the most recent cell;</li>
 *   <li>the table-close token (or end of input) flushes the pending row.</li>
 * </ul>
 *
 * <p>Span attributes are limited to {@value #MAX_SPAN}.</p>
 *
 * @since 0.1.0
 */
public final class WikiTableParser {
  static final String TABLE_OPEN = "{|";
  static final String TABLE_CLOSE = "|}";
  private static final char HEADER_TOKEN = '!';
  private static final char CELL_TOKEN = '|';
  private static final char ROW_SEPARATOR = '-';
  private static final String COLSPAN = "colspan=";
  private static final String ROWSPAN = "rowspan=";
  private static final int MAX_LOGGED_LINE_BYTES = 120;
  /** Largest accepted rowspan or colspan. */
  static final int MAX_SPAN = 4096;

  private WikiTableParser() {}

  /**
   * Parses the table starting at the beginning of {@code text}.
   *
   * @param text markup positioned at a table-open token, optionally preceded by whitespace
   * @return reconstructed grid plus the text following the table
   * @throws TableFormatException if the markup is not a table or contains an unparsable line
   */
  public static ParsedTable parse(String text) {
    Objects.requireNonNull(text, "text");
    LineCursor lines = new LineCursor(text.stripLeading());
    String opening = lines.next();
    if (opening == null || !opening.strip().startsWith(TABLE_OPEN)) {
      throw new TableFormatException("Table must start with '" + TABLE_OPEN + "'", snippet(opening));
    }

    TableBuilder builder = new TableBuilder();
    String line;
    while ((line = lines.next()) != null) {
      String trimmed = line.strip();
      if (trimmed.startsWith(TABLE_CLOSE)) {
        break;
      }
      if (trimmed.isEmpty()) {
        continue;
      }
      char token = trimmed.charAt(0);
      if (token != HEADER_TOKEN && token != CELL_TOKEN) {
        builder.continueCell(trimmed);
        continue;
      }
      // Only an adjacent '-' separates rows; "| -1" is a cell whose content starts with a minus.
      if (trimmed.length() > 1 && trimmed.charAt(1) == ROW_SEPARATOR) {
        if (token == HEADER_TOKEN) {
          throw new TableFormatException("Row separator cannot be a header cell", snippet(trimmed));
        }
        builder.closeRow();
        continue;
      }
      builder.addCell(trimmed.substring(1).stripLeading(), token == HEADER_TOKEN, trimmed);
    }
    return new ParsedTable(builder.finish(), lines.remainder());
  }

  /**
   * Parses every table in {@code text}, skipping the prose between them.
   *
   * @param text markup that may contain any number of tables
   * @return grids in document order; empty when the text holds no table
   * @throws TableFormatException if a table contains an unparsable line
   */
  public static List<Grid> parseAll(String text) {
    Objects.requireNonNull(text, "text");
    List<Grid> grids = new ArrayList<>();
    String rest = seekTable(text);
    while (rest != null) {
      ParsedTable table = parse(rest);
      grids.add(table.grid());
      rest = seekTable(table.remainder());
    }
    return grids;
  }

  private static String seekTable(String text) {
    LineCursor lines = new LineCursor(text);
    int start = 0;
    String line;
    while ((line = lines.next()) != null) {
      if (line.strip().startsWith(TABLE_OPEN)) {
        return text.substring(start);
      }
      start = lines.position;
    }
    return null;
  }

  private static String snippet(String line) {
    return line == null ? "" : Logs.truncate(line, MAX_LOGGED_LINE_BYTES);
  }

  private static final class TableBuilder {
    private final List<List<Cell>> rows = new ArrayList<>();
    private final List<Cell> activeSpans = new ArrayList<>();
    private List<Cell> currentRow = new ArrayList<>();
    private List<Cell> lastCellRow;
    private int x;
    private int y;

    void closeRow() {
      if (y == 0 && currentRow.isEmpty()) {
        // Stray separator directly after the table-open line.
        return;
      }
      rows.add(currentRow);
      currentRow = new ArrayList<>();
      x = 0;
      y++;
      activeSpans.removeIf(span -> (long) span.y() + span.rowspan() <= y);
    }

    void addCell(String rest, boolean header, String line) {
      skipMergedColumns();

      int colspan = 1;
      int rowspan = 1;
      String remaining = rest;
      while (true) {
        if (remaining.startsWith(COLSPAN)) {
          colspan = spanValue(remaining, COLSPAN, line);
        } else if (remaining.startsWith(ROWSPAN)) {
          rowspan = spanValue(remaining, ROWSPAN, line);
        } else {
          break;
        }
        remaining = afterAttribute(remaining);
      }
      if (!remaining.isEmpty() && remaining.charAt(0) == CELL_TOKEN) {
        remaining = remaining.substring(1);
      }

      Cell cell = new Cell(remaining.strip(), header, x, y, rowspan, colspan);
      if (rowspan > 1) {
        activeSpans.add(cell);
      }
      currentRow.add(cell);
      lastCellRow = currentRow;
      x += colspan;
    }

    void continueCell(String line) {
      if (lastCellRow == null || lastCellRow.isEmpty()) {
        throw new TableFormatException("Continuation line has no cell to extend", snippet(line));
      }
      int index = lastCellRow.size() - 1;
      lastCellRow.set(index, lastCellRow.get(index).withContinuation(line));
    }

    Grid finish() {
      rows.add(currentRow);
      return Grid.of(rows);
    }

    private void skipMergedColumns() {
      boolean moved = true;
      while (moved) {
        moved = false;
        for (Cell span : activeSpans) {
          if (span.covers(x, y)) {
            x += span.colspan();
            moved = true;
            break;
          }
        }
      }
    }

    private static int spanValue(String attribute, String name, String line) {
      int open = attribute.indexOf('"');
      int close = open < 0 ? -1 : attribute.indexOf('"', open + 1);
      if (open < 0 || close < 0) {
        throw new TableFormatException("Unquoted " + name + " attribute", snippet(line));
      }
      String raw = attribute.substring(open + 1, close).strip();
      int value;
      try {
        value = Integer.parseInt(raw);
      } catch (NumberFormatException ex) {
        throw new TableFormatException(
            "Unparsable " + name + " value '" + raw + "'", snippet(line), ex);
      }
      if (value < 1 || value > MAX_SPAN) {
        throw new TableFormatException(
            name + " must be between 1 and " + MAX_SPAN + " (was " + value + ')', snippet(line));
      }
      return value;
    }

    private static String afterAttribute(String attribute) {
      int open = attribute.indexOf('"');
      int close = attribute.indexOf('"', open + 1);
      return attribute.substring(close + 1).stripLeading();
    }
  }

  private static final class LineCursor {
    private final String text;
    private int position;

    LineCursor(String text) {
      this.text = text;
    }

    String next() {
      if (position >= text.length()) {
        return null;
      }
      int end = text.indexOf('\n', position);
      String line;
      if (end < 0) {
        line = text.substring(position);
        position = text.length();
      } else {
        line = text.substring(position, end);
        position = end + 1;
      }
      return line.stripTrailing();
    }

    String remainder() {
      return position >= text.length() ? "" : text.substring(position);
    }
  }
}
