package ca.gc.cra.protomine.domain.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.protomine.domain.table.Cell;
import ca.gc.cra.protomine.domain.table.Grid;
import ca.gc.cra.protomine.domain.table.WikiTableParser;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class SchemaInferenceEngineTest {
  private final SchemaInferenceEngine engine = new SchemaInferenceEngine();

  @Test
  void flatColumnsBecomeLeafFields() {
    Grid names = grid("| Window ID\n|-\n| Slot\n|-\n| Count");
    Grid types = grid("| {{Type|VarInt}}\n|-\n| {{Type|Short}}\n|-\n| {{Type|Byte}}");

    CompositeList fields = engine.infer(names, types);

    assertEquals(List.of(
        new FieldNode("Window ID", new LeafType("{{Type|VarInt}}")),
        new FieldNode("Slot", new LeafType("{{Type|Short}}")),
        new FieldNode("Count", new LeafType("{{Type|Byte}}"))), fields.fields());
  }

  @Test
  void rowspanThreeStartsCompositeOverThreeRows() {
    Grid names = grid("""
        | rowspan="3"| Entries
        | Key
        |-
        | Value
        |-
        | Flags
        |-
        | Count
        """);
    Grid types = grid("""
        | rowspan="3"| {{Type|Array}}
        | {{Type|String}}
        |-
        | {{Type|Int}}
        |-
        | {{Type|Byte}}
        |-
        | {{Type|VarInt}}
        """);

    CompositeList fields = engine.infer(names, types);

    CompositeList nested = new CompositeList(List.of(
        new FieldNode("Key", new LeafType("{{Type|String}}")),
        new FieldNode("Value", new LeafType("{{Type|Int}}")),
        new FieldNode("Flags", new LeafType("{{Type|Byte}}"))));
    assertEquals(List.of(
        new FieldNode("Entries", new PairedType(new LeafType("{{Type|Array}}"), nested)),
        new FieldNode("Count", new LeafType("{{Type|VarInt}}"))), fields.fields());
    assertTrue(fields.get(0).isComposite());
    assertFalse(fields.get(1).isComposite());
  }

  @Test
  void nestedCompositesRecurse() {
    Grid names = grid("""
        | rowspan="2"| Outer
        | rowspan="2"| Inner
        | a
        |-
        | b
        """);
    Grid types = grid("""
        | rowspan="2"| Array
        | rowspan="2"| Optional
        | Int
        |-
        | Long
        """);

    CompositeList fields = engine.infer(names, types);

    FieldNode outer = fields.get(0);
    FieldNode inner = outer.children().orElseThrow().get(0);
    assertEquals("Inner", inner.name());
    assertEquals(List.of("a", "b"),
        inner.children().orElseThrow().fields().stream().map(FieldNode::name).toList());
  }

  @Test
  void heightMismatchIsSymmetryError() {
    Grid names = grid("| a\n|-\n| b");
    Grid types = grid("| Int");

    assertThrows(SymmetryException.class, () -> engine.infer(names, types));
  }

  @Test
  void cellCountMismatchIsSymmetryError() {
    Grid names = grid("| a\n| extra");
    Grid types = grid("| Int");

    assertThrows(SymmetryException.class, () -> engine.infer(names, types));
  }

  @Test
  void compositeRowspanMismatchIsSymmetryError() {
    Grid names = grid("| rowspan=\"2\"| list\n| a\n|-\n| b");
    Grid types = grid("| Array\n| Int\n|-\n| Long");

    assertThrows(SymmetryException.class, () -> engine.infer(names, types));
  }

  @Test
  void noFieldsMarkerProducesEmptyList() {
    Grid names = grid("| ''no fields''");

    assertTrue(engine.infer(names, Grid.empty()).isEmpty());
    assertTrue(engine.infer(names, grid("| ")).isEmpty());
  }

  @Test
  void noFieldsMarkerSkipsItsRowspan() {
    Grid names = grid("| rowspan=\"2\"|  ''no fields'' \n|-\n|-\n| trailing");
    Grid types = grid("| \n|-\n|-\n| Int");

    CompositeList fields = engine.infer(names, types);

    assertEquals(List.of(new FieldNode("trailing", new LeafType("Int"))), fields.fields());
  }

  @Test
  void hugeCompositeRowspanEndsLoop() {
    Grid names = Grid.of(List.of(List.of(
        new Cell("list", false, 0, 0, Integer.MAX_VALUE, 1), new Cell("a", false, 1, 0, 1, 1))));
    Grid types = Grid.of(List.of(List.of(
        new Cell("Array", false, 0, 0, Integer.MAX_VALUE, 1), new Cell("Int", false, 1, 0, 1, 1))));

    CompositeList fields = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> engine.infer(names, types));

    assertEquals(List.of("a"),
        fields.get(0).children().orElseThrow().fields().stream().map(FieldNode::name).toList());
  }

  @Test
  void hugeNoFieldsRowspanEndsLoop() {
    Grid names = Grid.of(List.of(List.of(new Cell("''no fields''", false, 0, 0, Integer.MAX_VALUE, 1))));

    CompositeList fields = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> engine.infer(names, Grid.empty()));

    assertTrue(fields.isEmpty());
  }

  @Test
  void hugeColspanCropsToEmptyNestedList() {
    Grid names = Grid.of(List.of(List.of(
        new Cell("list", false, 0, 0, 1, Integer.MAX_VALUE), new Cell("a", false, 1, 0, 1, 1))));
    Grid types = Grid.of(List.of(List.of(
        new Cell("Array", false, 0, 0, 1, Integer.MAX_VALUE), new Cell("Int", false, 1, 0, 1, 1))));

    FieldNode list = engine.infer(names, types).get(0);

    assertTrue(list.children().orElseThrow().isEmpty());
  }

  @Test
  void emptyRowsAreSkipped() {
    Grid names = grid("| a\n|-\n|-\n| b");
    Grid types = grid("| Int\n|-\n|-\n| Long");

    assertEquals(2, engine.infer(names, types).size());
  }

  @Test
  void nestingBeyondLimitFails() {
    Grid names = grid("| rowspan=\"2\"| Outer\n| rowspan=\"2\"| Inner\n| a\n|-\n| b");
    Grid types = grid("| rowspan=\"2\"| T\n| rowspan=\"2\"| U\n| Int\n|-\n| Long");
    SchemaInferenceEngine shallow = new SchemaInferenceEngine(TypeResolver.VERBATIM, "''no fields''", 1);

    NestingDepthException ex = assertThrows(NestingDepthException.class, () -> shallow.infer(names, types));
    assertEquals(1, ex.limit());
  }

  @Test
  void resolverSeesEveryTypeCell() {
    SchemaInferenceEngine upper = new SchemaInferenceEngine(
        text -> new LeafType(text.toUpperCase(Locale.ROOT)), "-", 4);
    Grid names = grid("| rowspan=\"2\"| list\n| a\n|-\n| b");
    Grid types = grid("| rowspan=\"2\"| array\n| int\n|-\n| long");

    FieldNode list = upper.infer(names, types).get(0);

    PairedType paired = (PairedType) list.type();
    assertEquals(new LeafType("ARRAY"), paired.descriptor());
    assertEquals(new LeafType("LONG"), paired.content().get(1).type());
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class,
        () -> new SchemaInferenceEngine(TypeResolver.VERBATIM, " ", 4));
    assertThrows(IllegalArgumentException.class,
        () -> new SchemaInferenceEngine(TypeResolver.VERBATIM, "''no fields''", -1));
  }

  private static Grid grid(String body) {
    return WikiTableParser.parse("{|\n" + body + "\n|}").grid();
  }
}
