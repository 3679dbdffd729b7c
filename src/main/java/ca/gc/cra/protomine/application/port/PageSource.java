package ca.gc.cra.protomine.application.port;

import java.io.IOException;

/**
 * Supplies the wiki markup of the protocol page for a given revision.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PageSource {
  /**
   * Returns the full markup of one page revision.
   *
   * @param revisionId revision identifier; sources holding a single page may ignore it
   * @return page markup, never {@code null}
   * @throws IOException if the page cannot be read
   */
  String fetchPage(long revisionId) throws IOException;
}
