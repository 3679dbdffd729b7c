package ca.gc.cra.protomine.domain.schema;

import ca.gc.cra.protomine.domain.table.Cell;
import ca.gc.cra.protomine.domain.table.Grid;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Infers a nested field tree from a field-name view and a field-type view of the same table rows.
 *
 * <p>Vertical merges are the only signal of nesting: a name row with more than one cell starts a
 * composite field whose first cell's rowspan is the number of rows the nested fields occupy. The
 * matching type cell must span the same rows. Any other disagreement between the two views raises
 * {@link SymmetryException} unless the name row is the configured "no fields" marker.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class SchemaInferenceEngine {
  /** Marker the wiki uses for packets without fields. */
  public static final String DEFAULT_NO_FIELDS_MARKER = "''no fields''";
  /** Default limit on composite nesting. */
  public static final int DEFAULT_MAX_NESTING_DEPTH = 16;

  private final TypeResolver resolver;
  private final String noFieldsMarker;
  private final int maxNestingDepth;

  /**
   * Creates an engine.
   *
   * @param resolver resolver applied to every type cell
   * @param noFieldsMarker trimmed name-cell content marking an intentionally empty field list
   * @param maxNestingDepth maximum composite nesting; must be {@code >= 0}
   * @throws IllegalArgumentException if {@code maxNestingDepth} is negative or the marker is blank
   */
  public SchemaInferenceEngine(TypeResolver resolver, String noFieldsMarker, int maxNestingDepth) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.noFieldsMarker = Objects.requireNonNull(noFieldsMarker, "noFieldsMarker").strip();
    if (this.noFieldsMarker.isEmpty()) {
      throw new IllegalArgumentException("noFieldsMarker must not be blank");
    }
    if (maxNestingDepth < 0) {
      throw new IllegalArgumentException("maxNestingDepth must be >= 0 (was " + maxNestingDepth + ')');
    }
    this.maxNestingDepth = maxNestingDepth;
  }

  /**
   * Creates an engine with the verbatim resolver, the wiki's marker, and the default depth limit.
   */
  public SchemaInferenceEngine() {
    this(TypeResolver.VERBATIM, DEFAULT_NO_FIELDS_MARKER, DEFAULT_MAX_NESTING_DEPTH);
  }

  /**
   * Infers the fields described by two synchronized views.
   *
   * @param names field-name view, rebased so its first data row is row 0
   * @param types field-type view covering the same rows
   * @return ordered fields; never a partial result
   * @throws SymmetryException if the views disagree outside the "no fields" convention
   * @throws NestingDepthException if composites nest deeper than the configured limit
   */
  public CompositeList infer(Grid names, Grid types) {
    Objects.requireNonNull(names, "names");
    Objects.requireNonNull(types, "types");
    return infer(names, types, 0);
  }

  private CompositeList infer(Grid names, Grid types, int depth) {
    if (names.height() != types.height() && !hasNoFieldsRow(names)) {
      throw new SymmetryException("Field name rows (" + names.height()
          + ") do not match field type rows (" + types.height() + ')');
    }

    List<FieldNode> fields = new ArrayList<>();
    int rowCount = Math.max(names.height(), types.height());
    for (int y = 0; y < rowCount; y++) {
      List<Cell> nameRow = names.row(y);
      List<Cell> typeRow = types.row(y);

      if (isNoFieldsRow(nameRow)) {
        y = skipRows(y, nameRow.get(0).rowspan(), rowCount);
        continue;
      }
      if (nameRow.size() != typeRow.size()) {
        throw new SymmetryException("Row " + y + " has " + nameRow.size() + " name cell(s) but "
            + typeRow.size() + " type cell(s)" + describeFirst(nameRow));
      }
      if (nameRow.isEmpty()) {
        continue;
      }

      Cell name = nameRow.get(0);
      Cell type = typeRow.get(0);
      if (nameRow.size() == 1) {
        fields.add(new FieldNode(name.content(), resolver.resolve(type.content())));
        continue;
      }

      if (name.rowspan() != type.rowspan()) {
        throw new SymmetryException("Composite field '" + name.content() + "' spans "
            + name.rowspan() + " name row(s) but " + type.rowspan() + " type row(s)");
      }
      if (depth + 1 > maxNestingDepth) {
        throw new NestingDepthException(maxNestingDepth, name.content());
      }
      CompositeList nested = infer(
          names.crop(rightOf(name), name.y(), Grid.UNBOUNDED, name.rowspan()),
          types.crop(rightOf(type), type.y(), Grid.UNBOUNDED, type.rowspan()),
          depth + 1);
      fields.add(new FieldNode(name.content(),
          new PairedType(resolver.resolve(type.content()), nested)));
      // The composite consumed its own rowspan; running past the end simply ends the loop.
      y = skipRows(y, name.rowspan(), rowCount);
    }
    return new CompositeList(fields);
  }

  /** Row index of the last row covered by a span starting at {@code y}, clamped to the grid. */
  private static int skipRows(int y, int rowspan, int rowCount) {
    return (int) Math.min(rowCount, (long) y + rowspan - 1);
  }

  private static int rightOf(Cell cell) {
    return (int) Math.min(Grid.UNBOUNDED, (long) cell.x() + cell.colspan());
  }

  private boolean hasNoFieldsRow(Grid names) {
    for (List<Cell> row : names.rows()) {
      if (isNoFieldsRow(row)) {
        return true;
      }
    }
    return false;
  }

  private boolean isNoFieldsRow(List<Cell> nameRow) {
    return nameRow.size() == 1 && nameRow.get(0).content().strip().equals(noFieldsMarker);
  }

  private static String describeFirst(List<Cell> row) {
    return row.isEmpty() ? "" : " starting at '" + row.get(0).content() + "'";
  }
}
