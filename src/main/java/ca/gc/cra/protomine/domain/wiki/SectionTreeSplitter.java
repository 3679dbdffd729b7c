package ca.gc.cra.protomine.domain.wiki;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits wiki page source into a tree of sections using {@code == Heading ==} lines.
 *
 * <p>A heading's level is its count of leading {@code =}. A heading becomes a child of the nearest
 * preceding heading with a lower level; text before the first heading belongs to the root.</p>
 *
 * @since 0.1.0
 */
public final class SectionTreeSplitter {
  private static final Pattern HEADING = Pattern.compile("^(=+)\\s*(.*?)\\s*=+\\s*$");

  private SectionTreeSplitter() {}

  /**
   * Splits {@code page} into sections.
   *
   * @param page complete page source
   * @return root section named {@link WikiSection#ROOT_NAME}
   */
  public static WikiSection split(String page) {
    Objects.requireNonNull(page, "page");
    Node root = new Node(WikiSection.ROOT_NAME, 0);
    Deque<Node> open = new ArrayDeque<>();
    open.push(root);

    for (String line : page.split("\n", -1)) {
      Matcher heading = HEADING.matcher(line.stripTrailing());
      if (!heading.matches()) {
        open.peek().text.append(line).append('\n');
        continue;
      }
      int level = heading.group(1).length();
      Node section = new Node(heading.group(2), level);
      while (open.peek().level >= level) {
        open.pop();
      }
      open.peek().children.add(section);
      open.push(section);
    }
    return root.toSection();
  }

  private static final class Node {
    private final String name;
    private final int level;
    private final StringBuilder text = new StringBuilder();
    private final List<Node> children = new ArrayList<>();

    Node(String name, int level) {
      this.name = name;
      this.level = level;
    }

    WikiSection toSection() {
      List<WikiSection> sections = new ArrayList<>(children.size());
      for (Node child : children) {
        sections.add(child.toSection());
      }
      return new WikiSection(name, level, text.toString().strip(), sections);
    }
  }
}
