package ca.gc.cra.protomine.domain.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * One named element of a packet schema.
 *
 * <p>A field is composite when its type is a {@link PairedType}; every other type makes it a leaf.</p>
 *
 * @param name field name as written in the field-name column
 * @param type resolved type
 *
 * @since 0.1.0
 */
public record FieldNode(String name, TypeNode type) {

  /**
   * Creates a field.
   *
   * @throws NullPointerException if {@code name} or {@code type} is {@code null}
   */
  public FieldNode {
    name = Objects.requireNonNull(name, "name");
    type = Objects.requireNonNull(type, "type");
  }

  /**
   * Returns whether this field nests further fields.
   *
   * @return {@code true} for composite fields
   */
  public boolean isComposite() {
    return type instanceof PairedType;
  }

  /**
   * Returns the nested fields of a composite field.
   *
   * @return nested sub-schema, or empty for leaf fields
   */
  public Optional<CompositeList> children() {
    if (type instanceof PairedType paired) {
      return Optional.of(paired.content());
    }
    return Optional.empty();
  }
}
