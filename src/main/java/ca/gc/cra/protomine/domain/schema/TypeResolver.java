package ca.gc.cra.protomine.domain.schema;

/**
 * Turns the text of a field-type cell into a {@link TypeNode}.
 *
 * <p>Mapping type names onto concrete wire encodings is left to implementations; the default keeps
 * the text as a {@link LeafType}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TypeResolver {
  /** Resolver that wraps the cell text unchanged. */
  TypeResolver VERBATIM = LeafType::new;

  /**
   * Resolves field-type cell text.
   *
   * @param typeText trimmed cell content; never {@code null}
   * @return resolved type; never {@code null}
   */
  TypeNode resolve(String typeText);
}
