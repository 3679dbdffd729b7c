package ca.gc.cra.protomine.domain.schema;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of named fields.
 *
 * @param fields fields in table row order; copied on construction
 *
 * @since 0.1.0
 */
public record CompositeList(List<FieldNode> fields) implements TypeNode {

  /**
   * Creates a composite list holding an immutable copy of {@code fields}.
   *
   * @throws NullPointerException if {@code fields} or any element is {@code null}
   */
  public CompositeList {
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
  }

  /**
   * Returns the number of direct fields.
   *
   * @return field count
   */
  public int size() {
    return fields.size();
  }

  /**
   * Returns whether there are no direct fields.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return fields.isEmpty();
  }

  /**
   * Returns the field at {@code index}.
   *
   * @param index zero-based position
   * @return field
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public FieldNode get(int index) {
    return fields.get(index);
  }
}
