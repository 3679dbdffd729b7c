package ca.gc.cra.protomine.domain.schema;

/**
 * Closed set of type shapes a packet field can carry.
 *
 * <ul>
 *   <li>{@link LeafType} holds type text that has not been resolved further.</li>
 *   <li>{@link PairedType} pairs a composite field's own type with its nested fields.</li>
 *   <li>{@link CompositeList} is an ordered list of named fields.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public sealed interface TypeNode permits LeafType, PairedType, CompositeList {}
