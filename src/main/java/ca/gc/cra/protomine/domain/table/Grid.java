package ca.gc.cra.protomine.domain.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable row-major grid of spanning cells reconstructed from a wiki table.
 *
 * <p>Row {@code i} holds exactly the cells whose origin row is {@code i}, ordered by column. Cells
 * merged down from earlier rows are only present in the row where they start; use
 * {@link #cellCovering(int, int)} to resolve a position inside a span.</p>
 *
 * <p>{@link #crop(int, int, int, int)} produces views rebased to {@code (0,0)}. Views share no mutable
 * state with their parent since {@link Cell} is immutable.</p>
 *
 * @since 0.1.0
 */
public final class Grid {
  /** Crop extent meaning "up to the edge of the grid". */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private static final Grid EMPTY = new Grid(List.of());

  private final List<List<Cell>> rows;
  private final int width;

  private Grid(List<List<Cell>> rows) {
    this.rows = rows;
    int maxX = 0;
    for (List<Cell> row : rows) {
      for (Cell cell : row) {
        maxX = (int) Math.max(maxX, Math.min(Integer.MAX_VALUE, (long) cell.x() + cell.colspan()));
      }
    }
    this.width = maxX;
  }

  /**
   * Creates a grid from rows of cells.
   *
   * @param rows ordered rows; row {@code i} must only hold cells whose origin row is {@code i}
   * @return immutable grid
   * @throws IllegalArgumentException if a cell sits in the wrong row or columns decrease within a row
   */
  public static Grid of(List<? extends List<Cell>> rows) {
    Objects.requireNonNull(rows, "rows");
    List<List<Cell>> copy = new ArrayList<>(rows.size());
    for (int y = 0; y < rows.size(); y++) {
      List<Cell> row = List.copyOf(rows.get(y));
      int lastX = -1;
      for (Cell cell : row) {
        if (cell.y() != y) {
          throw new IllegalArgumentException(
              "cell at row " + cell.y() + " placed in row " + y + ": " + cell.content());
        }
        if (cell.x() < lastX) {
          throw new IllegalArgumentException("cell columns must not decrease within row " + y);
        }
        lastX = cell.x();
      }
      copy.add(row);
    }
    return new Grid(List.copyOf(copy));
  }

  /**
   * Returns a grid with no rows.
   *
   * @return shared empty grid
   */
  public static Grid empty() {
    return EMPTY;
  }

  /**
   * Returns the grid width, the largest {@code x + colspan} of any cell.
   *
   * @return width in columns; {@code 0} for an empty grid
   */
  public int width() {
    return width;
  }

  /**
   * Returns the number of rows.
   *
   * @return row count
   */
  public int height() {
    return rows.size();
  }

  /**
   * Returns the cells whose origin lies in row {@code y}.
   *
   * @param y zero-based row index
   * @return unmodifiable row; empty when {@code y} is outside the grid
   */
  public List<Cell> row(int y) {
    if (y < 0 || y >= rows.size()) {
      return List.of();
    }
    return rows.get(y);
  }

  /**
   * Returns every row of the grid.
   *
   * @return unmodifiable list of unmodifiable rows
   */
  public List<List<Cell>> rows() {
    return rows;
  }

  /**
   * Looks up the cell whose origin is exactly {@code (x, y)}.
   *
   * @param x zero-based column
   * @param y zero-based row
   * @return cell starting at the position, if any
   */
  public Optional<Cell> cellAt(int x, int y) {
    for (Cell cell : row(y)) {
      if (cell.x() == x) {
        return Optional.of(cell);
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the cell whose rectangle covers {@code (x, y)}, following spans from earlier rows.
   *
   * @param x zero-based column
   * @param y zero-based row
   * @return covering cell, if any
   */
  public Optional<Cell> cellCovering(int x, int y) {
    if (x < 0 || y < 0) {
      return Optional.empty();
    }
    for (int rowIndex = Math.min(y, rows.size() - 1); rowIndex >= 0; rowIndex--) {
      for (Cell cell : rows.get(rowIndex)) {
        if (cell.covers(x, y)) {
          return Optional.of(cell);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the header cells of the first row whose content satisfies {@code predicate}.
   *
   * @param predicate content test
   * @return matching header cells in column order
   */
  public List<Cell> searchHeaders(Predicate<String> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    List<Cell> matches = new ArrayList<>();
    // Headers only exist on the first row.
    for (Cell cell : row(0)) {
      if (cell.header() && predicate.test(cell.content())) {
        matches.add(cell);
      }
    }
    return List.copyOf(matches);
  }

  /**
   * Returns a rebased view holding the cells whose origin lies in
   * {@code [x0, x0+width) x [y0, y0+height)}.
   *
   * <p>Row {@code i} of the view corresponds to row {@code y0 + i} of this grid; rows past the last
   * retained cell are dropped. Cells keep their spans even when they extend beyond the crop.</p>
   *
   * @param x0 first column to keep
   * @param y0 first row to keep
   * @param width number of columns to keep, or {@link #UNBOUNDED}
   * @param height number of rows to keep, or {@link #UNBOUNDED}
   * @return cropped grid with the crop's top-left at {@code (0,0)}
   * @throws IllegalArgumentException if any argument is negative
   */
  public Grid crop(int x0, int y0, int width, int height) {
    if (x0 < 0 || y0 < 0 || width < 0 || height < 0) {
      throw new IllegalArgumentException(
          "crop arguments must be >= 0 (was " + x0 + ',' + y0 + ',' + width + ',' + height + ')');
    }
    List<List<Cell>> cropped = new ArrayList<>();
    int lastNonEmpty = -1;
    for (int y = y0; y < rows.size() && y - y0 < height; y++) {
      List<Cell> kept = new ArrayList<>();
      for (Cell cell : rows.get(y)) {
        if (cell.x() >= x0 && cell.x() - x0 < width) {
          kept.add(cell.translate(-x0, -y0));
        }
      }
      cropped.add(List.copyOf(kept));
      if (!kept.isEmpty()) {
        lastNonEmpty = cropped.size() - 1;
      }
    }
    if (lastNonEmpty < 0) {
      return EMPTY;
    }
    return new Grid(List.copyOf(cropped.subList(0, lastNonEmpty + 1)));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Grid grid)) {
      return false;
    }
    return rows.equals(grid.rows);
  }

  @Override
  public int hashCode() {
    return rows.hashCode();
  }

  @Override
  public String toString() {
    return "Grid[" + width + 'x' + rows.size() + ']';
  }
}
