package ca.gc.cra.protomine.domain.schema;

import java.util.Objects;

/**
 * Type text copied from the field-type column, e.g. {@code {{Type|VarInt}}}.
 *
 * @param text type descriptor text; never {@code null}
 *
 * @since 0.1.0
 */
public record LeafType(String text) implements TypeNode {

  /**
   * Creates a leaf type.
   *
   * @throws NullPointerException if {@code text} is {@code null}
   */
  public LeafType {
    text = Objects.requireNonNull(text, "text");
  }
}
