package ca.gc.cra.protomine.domain.table;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Draws the outline of every cell in a grid so merged regions can be checked by eye.
 *
 * @since 0.1.0
 */
public final class GridShapeRenderer {
  private static final char HORIZONTAL = '─';
  private static final char VERTICAL = '│';
  private static final char CORNER = '+';

  private final int columnWidth;
  private final int rowHeight;

  /**
   * Creates a renderer with the given character cell size.
   *
   * @param columnWidth characters per grid column; must be at least 2
   * @param rowHeight lines per grid row; must be at least 2
   * @throws IllegalArgumentException if either size is too small to draw a border
   */
  public GridShapeRenderer(int columnWidth, int rowHeight) {
    if (columnWidth < 2 || rowHeight < 2) {
      throw new IllegalArgumentException("columnWidth and rowHeight must be >= 2");
    }
    this.columnWidth = columnWidth;
    this.rowHeight = rowHeight;
  }

  /**
   * Creates a renderer using five characters per column and two lines per row.
   */
  public GridShapeRenderer() {
    this(5, 2);
  }

  /**
   * Renders the outline of {@code grid}.
   *
   * @param grid grid to draw
   * @return multi-line drawing; trailing spaces are removed from every line
   */
  public String render(Grid grid) {
    Objects.requireNonNull(grid, "grid");
    int bottom = 0;
    for (List<Cell> row : grid.rows()) {
      for (Cell cell : row) {
        bottom = Math.max(bottom, cell.y() + cell.rowspan());
      }
    }
    char[][] canvas = new char[bottom * rowHeight + 1][grid.width() * columnWidth + 1];
    for (char[] line : canvas) {
      Arrays.fill(line, ' ');
    }

    for (List<Cell> row : grid.rows()) {
      for (Cell cell : row) {
        int left = cell.x() * columnWidth;
        int top = cell.y() * rowHeight;
        int right = left + cell.colspan() * columnWidth;
        int lower = top + cell.rowspan() * rowHeight;
        for (int cx = left + 1; cx < right; cx++) {
          canvas[top][cx] = HORIZONTAL;
          canvas[lower][cx] = HORIZONTAL;
        }
        for (int cy = top + 1; cy < lower; cy++) {
          canvas[cy][left] = VERTICAL;
          canvas[cy][right] = VERTICAL;
        }
        canvas[top][left] = CORNER;
        canvas[top][right] = CORNER;
        canvas[lower][left] = CORNER;
        canvas[lower][right] = CORNER;
      }
    }

    StringBuilder out = new StringBuilder();
    for (int i = 0; i < canvas.length; i++) {
      if (i > 0) {
        out.append('\n');
      }
      out.append(new String(canvas[i]).stripTrailing());
    }
    return out.toString();
  }
}
