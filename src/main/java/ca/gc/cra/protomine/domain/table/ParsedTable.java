package ca.gc.cra.protomine.domain.table;

import java.util.Objects;

/**
 * Result of parsing one wiki table.
 *
 * @param grid reconstructed grid
 * @param remainder text following the table-close line; empty when the input ended
 *
 * @since 0.1.0
 */
public record ParsedTable(Grid grid, String remainder) {

  /**
   * Creates a result ensuring both components are present.
   *
   * @throws NullPointerException if {@code grid} or {@code remainder} is {@code null}
   */
  public ParsedTable {
    grid = Objects.requireNonNull(grid, "grid");
    remainder = Objects.requireNonNull(remainder, "remainder");
  }

  /**
   * Indicates whether any text followed the table.
   *
   * @return {@code true} when {@link #remainder()} holds non-blank text
   */
  public boolean hasRemainder() {
    return !remainder.isBlank();
  }
}
