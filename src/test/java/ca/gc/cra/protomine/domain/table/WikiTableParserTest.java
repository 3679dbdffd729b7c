package ca.gc.cra.protomine.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.protomine.Fixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class WikiTableParserTest {

  @Test
  void rowCountIsSeparatorsPlusOne() {
    ParsedTable parsed = WikiTableParser.parse("""
        {| class="wikitable"
        ! A
        ! B
        |-
        | a1
        | b1
        |-
        | a2
        | b2
        |}
        """);

    Grid grid = parsed.grid();
    assertEquals(3, grid.height());
    assertEquals(2, grid.width());
    assertTrue(grid.cellAt(0, 0).orElseThrow().header());
    assertFalse(grid.cellAt(1, 2).orElseThrow().header());
    assertEquals("b2", grid.cellAt(1, 2).orElseThrow().content());
  }

  @Test
  void separatorDirectlyAfterOpenIsIgnored() {
    Grid grid = WikiTableParser.parse("""
        {|
        |-
        | only
        |}
        """).grid();

    assertEquals(1, grid.height());
    assertEquals(new Cell("only", false, 0, 0, 1, 1), grid.cellAt(0, 0).orElseThrow());
  }

  @Test
  void rowspanPushesLaterCellsRight() {
    Grid grid = WikiTableParser.parse("""
        {|
        ! A
        ! B
        ! C
        |-
        | rowspan="2"| a1
        | b1
        | c1
        |-
        | b2
        | c2
        |}
        """).grid();

    assertEquals(List.of(
        new Cell("b2", false, 1, 2, 1, 1),
        new Cell("c2", false, 2, 2, 1, 1)), grid.row(2));
    assertEquals("a1", grid.cellCovering(0, 2).orElseThrow().content());
  }

  @Test
  void colspanAndRowspanInEitherOrder() {
    Grid grid = WikiTableParser.parse("""
        {|
        | colspan="2" rowspan="2"| big
        | right
        |-
        | below right
        |-
        | rowspan="1" colspan="3"| wide
        |}
        """).grid();

    assertEquals(new Cell("big", false, 0, 0, 2, 2), grid.cellAt(0, 0).orElseThrow());
    assertEquals(2, grid.cellAt(2, 0).orElseThrow().x());
    assertEquals(2, grid.row(1).get(0).x());
    assertEquals(new Cell("wide", false, 0, 2, 1, 3), grid.cellAt(0, 2).orElseThrow());
  }

  @Test
  void continuationLinesExtendLastCell() {
    Grid grid = WikiTableParser.parse("""
        {|
        | name
        | first line
        second line

        third line
        |}
        """).grid();

    assertEquals("first line\nsecond line\nthird line", grid.cellAt(1, 0).orElseThrow().content());
  }

  @Test
  void returnsTextAfterTable() {
    ParsedTable parsed = WikiTableParser.parse("""
          {|
        | cell
        |}
        After the table.
        """);

    assertTrue(parsed.hasRemainder());
    assertEquals("After the table.\n", parsed.remainder());
  }

  @Test
  void lastLineWithoutNewlineOrCloseIsKept() {
    ParsedTable parsed = WikiTableParser.parse("{|\n| a\n|-\n| b");

    assertEquals(2, parsed.grid().height());
    assertEquals("b", parsed.grid().cellAt(0, 1).orElseThrow().content());
    assertFalse(parsed.hasRemainder());
  }

  @Test
  void emptyCellKeepsItsColumn() {
    Grid grid = WikiTableParser.parse("{|\n|\n| x\n|}").grid();

    assertEquals("", grid.cellAt(0, 0).orElseThrow().content());
    assertEquals("x", grid.cellAt(1, 0).orElseThrow().content());
  }

  @Test
  void rejectsTextThatIsNotATable() {
    TableFormatException ex = assertThrows(TableFormatException.class,
        () -> WikiTableParser.parse("Just prose\n{|\n|}"));
    assertEquals("Just prose", ex.line());
  }

  @Test
  void rejectsHeaderRowSeparator() {
    assertThrows(TableFormatException.class, () -> WikiTableParser.parse("{|\n! A\n!-\n|}"));
  }

  @Test
  void rejectsBadSpanValues() {
    assertThrows(TableFormatException.class,
        () -> WikiTableParser.parse("{|\n| rowspan=\"two\"| a\n|}"));
    assertThrows(TableFormatException.class,
        () -> WikiTableParser.parse("{|\n| rowspan=2| a\n|}"));
    assertThrows(TableFormatException.class,
        () -> WikiTableParser.parse("{|\n| colspan=\"0\"| a\n|}"));
  }

  @Test
  void cellStartingWithMinusIsNotARowSeparator() {
    Grid grid = WikiTableParser.parse("""
        {|
        ! A
        ! B
        |-
        | x
        | -1 if absent
        |-
        | y
        | z
        |}
        """).grid();

    assertEquals(3, grid.height());
    assertEquals(List.of(new Cell("x", false, 0, 1, 1, 1), new Cell("-1 if absent", false, 1, 1, 1, 1)),
        grid.row(1));
  }

  @Test
  void spacedMinusAfterHeaderTokenIsHeaderCell() {
    Grid grid = WikiTableParser.parse("{|\n! -\n|}").grid();

    assertEquals(new Cell("-", true, 0, 0, 1, 1), grid.cellAt(0, 0).orElseThrow());
  }

  @Test
  void rejectsSpansAboveLimit() {
    assertThrows(TableFormatException.class,
        () -> WikiTableParser.parse("{|\n| rowspan=\"2147483647\"| a\n|}"));
    assertThrows(TableFormatException.class,
        () -> WikiTableParser.parse("{|\n| colspan=\"" + (WikiTableParser.MAX_SPAN + 1) + "\"| a\n|}"));
    assertEquals(WikiTableParser.MAX_SPAN, WikiTableParser.parse(
        "{|\n| rowspan=\"" + WikiTableParser.MAX_SPAN + "\"| a\n|}").grid().row(0).get(0).rowspan());
  }

  @Test
  void rejectsContinuationBeforeAnyCell() {
    assertThrows(TableFormatException.class, () -> WikiTableParser.parse("{|\nstray text\n|}"));
  }

  @Test
  void parsesMerchantOffersTable() {
    String page = Fixtures.page("merchant_offers.wiki");
    Grid grid = WikiTableParser.parse(page.substring(page.indexOf("{|"))).grid();

    assertEquals(16, grid.height());
    assertEquals(8, grid.width());
    assertEquals("Trades", grid.cellAt(3, 2).orElseThrow().content());
    assertEquals("{{Type|Slot}}", grid.cellAt(6, 3).orElseThrow().content());
    assertEquals("Villager level", grid.cellAt(3, 12).orElseThrow().content());
  }

  @Test
  void parseAllFindsEveryTable() {
    List<Grid> grids = WikiTableParser.parseAll(Fixtures.page("protocol.wiki"));

    assertEquals(5, grids.size());
    assertEquals("0xFE", grids.get(1).cellAt(0, 1).orElseThrow().content());
    assertTrue(WikiTableParser.parseAll("no tables here").isEmpty());
  }
}
