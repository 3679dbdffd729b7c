package ca.gc.cra.protomine.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class GridShapeRendererTest {

  @Test
  void drawsSingleCell() {
    Grid grid = Grid.of(List.of(List.of(new Cell("a", false, 0, 0, 1, 1))));

    assertEquals("+────+\n│    │\n+────+", new GridShapeRenderer().render(grid));
  }

  @Test
  void mergedCellHasNoInnerBorder() {
    Grid grid = WikiTableParser.parse("""
        {|
        | rowspan="2"| tall
        | top
        |-
        | bottom
        |}
        """).grid();

    String expected = String.join("\n",
        "+──+──+",
        "│  │  │",
        "│  +──+",
        "│  │  │",
        "+──+──+");
    assertEquals(expected, new GridShapeRenderer(3, 2).render(grid));
  }

  @Test
  void emptyGridRendersSingleBlankLine() {
    assertEquals("", new GridShapeRenderer().render(Grid.empty()));
  }

  @Test
  void rejectsCellsTooSmallToDraw() {
    assertThrows(IllegalArgumentException.class, () -> new GridShapeRenderer(1, 2));
    assertThrows(IllegalArgumentException.class, () -> new GridShapeRenderer(2, 1));
  }
}
