package ca.gc.cra.protomine.domain.schema;

import java.util.Objects;

/**
 * Renders a type tree as indented text for console inspection.
 *
 * <pre>
 * {
 *   Window ID : {{Type|VarInt}}
 *   Trades : {{Type|Prefixed Array}} &amp; {
 *     Input item 1 : Trade Item
 *   }
 * }
 * </pre>
 *
 * @since 0.1.0
 */
public final class SchemaRenderer {
  private static final String INDENT = "  ";

  private SchemaRenderer() {}

  /**
   * Renders {@code node} and everything nested under it.
   *
   * @param node type tree to render
   * @return multi-line text; multi-line cell content is indented with its field
   */
  public static String render(TypeNode node) {
    Objects.requireNonNull(node, "node");
    StringBuilder out = new StringBuilder();
    append(out, node, "");
    return out.toString();
  }

  private static void append(StringBuilder out, TypeNode node, String indent) {
    if (node instanceof LeafType leaf) {
      out.append(leaf.text().replace("\n", "\n" + indent));
    } else if (node instanceof PairedType paired) {
      append(out, paired.descriptor(), indent);
      out.append(" & ");
      append(out, paired.content(), indent);
    } else if (node instanceof CompositeList list) {
      out.append('{');
      String inner = indent + INDENT;
      for (FieldNode field : list.fields()) {
        out.append('\n').append(inner).append(field.name().replace("\n", "\n" + inner)).append(" : ");
        append(out, field.type(), inner);
      }
      out.append('\n').append(indent).append('}');
    }
  }
}
