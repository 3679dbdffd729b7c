package ca.gc.cra.protomine.domain.schema;

import java.util.Objects;

/**
 * Type of a composite field: the field's own descriptor (for example a prefixed array) and the
 * fields nested under it.
 *
 * @param descriptor resolved type of the composite cell itself
 * @param content nested sub-schema
 *
 * @since 0.1.0
 */
public record PairedType(TypeNode descriptor, CompositeList content) implements TypeNode {

  /**
   * Creates a paired type.
   *
   * @throws NullPointerException if either component is {@code null}
   */
  public PairedType {
    descriptor = Objects.requireNonNull(descriptor, "descriptor");
    content = Objects.requireNonNull(content, "content");
  }
}
