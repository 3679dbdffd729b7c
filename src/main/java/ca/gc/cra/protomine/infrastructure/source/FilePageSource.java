package ca.gc.cra.protomine.infrastructure.source;

import ca.gc.cra.protomine.application.port.PageSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads saved page revisions from the local file system.
 *
 * <p>When constructed with a directory, revision {@code N} is read from {@code <dir>/N.wiki}. When
 * constructed with a regular file, that file is returned for every revision.</p>
 *
 * @since 0.1.0
 */
public final class FilePageSource implements PageSource {
  private static final Logger log = LoggerFactory.getLogger(FilePageSource.class);
  /** File extension of saved revisions inside a page directory. */
  public static final String EXTENSION = ".wiki";

  private final Path location;

  /**
   * Creates a source for a page file or a directory of revisions.
   *
   * @param location file or directory
   */
  public FilePageSource(Path location) {
    this.location = Objects.requireNonNull(location, "location");
  }

  /**
   * Reads the page text as UTF-8.
   *
   * @param revisionId revision to read; must be positive when reading from a directory
   * @return page markup
   * @throws IOException if the file is missing or unreadable
   * @throws IllegalArgumentException if a directory is configured and {@code revisionId} is not positive
   */
  @Override
  public String fetchPage(long revisionId) throws IOException {
    Path file = resolve(revisionId);
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString(), null, "page revision file not found");
    }
    String page = Files.readString(file, StandardCharsets.UTF_8);
    log.debug("Read {} characters of page markup from {}", page.length(), file);
    return page;
  }

  /**
   * Returns the file that holds {@code revisionId}.
   *
   * @param revisionId revision identifier
   * @return page file path
   */
  Path resolve(long revisionId) {
    if (!Files.isDirectory(location)) {
      return location;
    }
    if (revisionId <= 0) {
      throw new IllegalArgumentException("revision is required when reading from directory " + location);
    }
    return location.resolve(revisionId + EXTENSION);
  }
}
