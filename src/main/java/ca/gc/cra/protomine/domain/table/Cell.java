package ca.gc.cra.protomine.domain.table;

import java.util.Objects;

/**
 * Immutable wiki table cell positioned on the reconstructed grid.
 *
 * @param content trimmed cell text; continuation lines are joined with {@code '\n'}
 * @param header whether the cell was introduced with the {@code !} header token
 * @param x zero-based column of the cell origin
 * @param y zero-based row of the cell origin
 * @param rowspan number of rows the cell occupies (at least 1)
 * @param colspan number of columns the cell occupies (at least 1)
 *
 * @since 0.1.0
 */
public record Cell(String content, boolean header, int x, int y, int rowspan, int colspan) {

  /**
   * Creates a cell ensuring origin and span invariants.
   *
   * @throws IllegalArgumentException if the origin is negative or a span is below one
   * @throws NullPointerException if {@code content} is {@code null}
   */
  public Cell {
    content = Objects.requireNonNull(content, "content");
    if (x < 0 || y < 0) {
      throw new IllegalArgumentException("origin must be >= 0 (was " + x + ',' + y + ')');
    }
    if (rowspan < 1) {
      throw new IllegalArgumentException("rowspan must be >= 1 (was " + rowspan + ')');
    }
    if (colspan < 1) {
      throw new IllegalArgumentException("colspan must be >= 1 (was " + colspan + ')');
    }
  }

  /**
   * Returns whether the cell rectangle {@code [x, x+colspan) x [y, y+rowspan)} contains the position.
   *
   * @param px column to test
   * @param py row to test
   * @return {@code true} when the position lies inside this cell
   */
  public boolean covers(int px, int py) {
    return x <= px && px < (long) x + colspan && y <= py && py < (long) y + rowspan;
  }

  /**
   * Returns a copy of this cell with its origin moved by the given offsets.
   *
   * @param dx column delta
   * @param dy row delta
   * @return translated cell
   */
  public Cell translate(int dx, int dy) {
    return new Cell(content, header, x + dx, y + dy, rowspan, colspan);
  }

  /**
   * Returns a copy of this cell with {@code line} appended on a new line.
   *
   * @param line continuation text
   * @return cell holding the extended content
   */
  Cell withContinuation(String line) {
    return new Cell(content + '\n' + line, header, x, y, rowspan, colspan);
  }
}
