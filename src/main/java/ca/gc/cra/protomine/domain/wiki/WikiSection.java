package ca.gc.cra.protomine.domain.wiki;

import java.util.List;
import java.util.Objects;

/**
 * Named section of a wiki page with its own text and nested subsections.
 *
 * @param name heading text; {@code root} for the page itself
 * @param level heading level (count of {@code =}); {@code 0} for the page root
 * @param text section text up to the first subsection heading, stripped
 * @param children subsections in page order
 *
 * @since 0.1.0
 */
public record WikiSection(String name, int level, String text, List<WikiSection> children) {
  /** Name given to the page root. */
  public static final String ROOT_NAME = "root";

  /**
   * Creates a section holding an immutable copy of {@code children}.
   *
   * @throws NullPointerException if any component is {@code null}
   * @throws IllegalArgumentException if {@code level} is negative
   */
  public WikiSection {
    name = Objects.requireNonNull(name, "name");
    text = Objects.requireNonNull(text, "text");
    children = List.copyOf(Objects.requireNonNull(children, "children"));
    if (level < 0) {
      throw new IllegalArgumentException("level must be >= 0 (was " + level + ')');
    }
  }

  /**
   * Creates a leaf section without subsections.
   *
   * @param name heading text
   * @param level heading level
   * @param text section text
   * @return section
   */
  public static WikiSection leaf(String name, int level, String text) {
    return new WikiSection(name, level, text, List.of());
  }
}
