package ca.gc.cra.protomine.domain.schema;

import ca.gc.cra.protomine.domain.ProtomineException;

/**
 * Raised when composite fields nest deeper than the configured limit.
 *
 * @since 0.1.0
 */
public class NestingDepthException extends ProtomineException {
  private static final long serialVersionUID = 1L;

  private final int limit;

  /**
   * Creates an exception for a table exceeding {@code limit} levels.
   *
   * @param limit configured maximum nesting depth
   * @param field composite field at which the limit was crossed
   */
  public NestingDepthException(int limit, String field) {
    super("Composite nesting exceeds " + limit + " levels at field '" + field + "'");
    this.limit = limit;
  }

  /**
   * Returns the configured depth limit.
   *
   * @return maximum nesting depth
   */
  public int limit() {
    return limit;
  }
}
