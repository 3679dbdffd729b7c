package ca.gc.cra.protomine.domain.wiki;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.protomine.Fixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class SectionTreeSplitterTest {

  @Test
  void buildsTreeFromHeadingLevels() {
    WikiSection root = SectionTreeSplitter.split("""
        Intro text.
        == Status ==
        === Clientbound ===
        ==== Pong ====
        Pong body.
        === Serverbound ===
        == Play ==
        """);

    assertEquals(WikiSection.ROOT_NAME, root.name());
    assertEquals("Intro text.", root.text());
    assertEquals(List.of("Status", "Play"), names(root.children()));

    WikiSection status = root.children().get(0);
    assertEquals(2, status.level());
    assertEquals(List.of("Clientbound", "Serverbound"), names(status.children()));
    WikiSection pong = status.children().get(0).children().get(0);
    assertEquals("Pong", pong.name());
    assertEquals(4, pong.level());
    assertEquals("Pong body.", pong.text());
    assertTrue(root.children().get(1).children().isEmpty());
  }

  @Test
  void headingWithoutSpacesAndTrailingWhitespace() {
    WikiSection root = SectionTreeSplitter.split("==Login==   \nbody\n");

    assertEquals("Login", root.children().get(0).name());
    assertEquals("body", root.children().get(0).text());
  }

  @Test
  void deeperHeadingAfterShallowerOneStartsNewBranch() {
    WikiSection root = SectionTreeSplitter.split("=== Orphan ===\n== Top ==\n=== Child ===\n");

    assertEquals(List.of("Orphan", "Top"), names(root.children()));
    assertEquals(List.of("Child"), names(root.children().get(1).children()));
  }

  @Test
  void splitsProtocolPage() {
    WikiSection root = SectionTreeSplitter.split(Fixtures.page("protocol.wiki"));

    assertEquals(List.of("Definitions", "Handshaking", "Status", "Navigation"), names(root.children()));
    WikiSection handshake = root.children().get(1).children().get(0).children().get(0);
    assertEquals("Handshake", handshake.name());
    assertTrue(handshake.text().startsWith("This causes the server"));
  }

  private static List<String> names(List<WikiSection> sections) {
    return sections.stream().map(WikiSection::name).toList();
  }
}
