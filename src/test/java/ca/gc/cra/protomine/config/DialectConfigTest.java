package ca.gc.cra.protomine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DialectConfigTest {

  @Test
  void defaultsDescribeTheProtocolPage() {
    DialectConfig dialect = DialectConfig.defaults();

    assertTrue(dialect.isState("Play"));
    assertTrue(dialect.isIgnored("Navigation"));
    assertTrue(dialect.isDirection("Serverbound"));
    assertFalse(dialect.isState("Navigation"));
    assertEquals("''no fields''", dialect.noFieldsMarker());
  }

  @Test
  void fromMapOverridesListsAndLabels() {
    DialectConfig dialect = DialectConfig.fromMap(Map.of(
        "dialect.states", "Status, Login",
        "dialect.fieldTypeHeader", "Type",
        "dialect.maxNestingDepth", "4"));

    assertEquals(List.of("Status", "Login"), dialect.states());
    assertEquals("Type", dialect.fieldTypeHeader());
    assertEquals("Field Name", dialect.fieldNameHeader());
    assertEquals(4, dialect.maxNestingDepth());
  }

  @Test
  void blankIgnoredListClearsIt() {
    DialectConfig dialect = DialectConfig.fromMap(Map.of("dialect.ignored", ""));

    assertTrue(dialect.ignoredSections().isEmpty());
    assertEquals(DialectConfig.defaults().states(), dialect.states());
  }

  @Test
  void stateCannotAlsoBeIgnored() {
    assertThrows(IllegalArgumentException.class,
        () -> DialectConfig.fromMap(Map.of("dialect.ignored", "Status")));
  }

  @Test
  void nestingDepthOutOfRangeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> DialectConfig.fromMap(Map.of("dialect.maxNestingDepth", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> DialectConfig.fromMap(Map.of("dialect.maxNestingDepth", "deep")));
  }

  @Test
  void emptyListEntryIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> DialectConfig.fromMap(Map.of("dialect.directions", "Clientbound,,Serverbound")));
  }
}
