package ca.gc.cra.protomine.domain.table;

import ca.gc.cra.protomine.domain.ProtomineException;

/**
 * Raised when wiki table markup cannot be turned into a grid.
 *
 * <p>Fatal to the table being built: a continuation line with no cell to extend, an unparsable
 * span attribute, or input that does not start with a table-open token.</p>
 *
 * @since 0.1.0
 */
public class TableFormatException extends ProtomineException {
  private static final long serialVersionUID = 1L;

  private final String line;

  /**
   * Creates an exception for the offending markup line.
   *
   * @param message description of the failure
   * @param line markup line that triggered the failure; may be empty
   */
  public TableFormatException(String message, String line) {
    super(message);
    this.line = line == null ? "" : line;
  }

  /**
   * Creates an exception for the offending markup line with an underlying cause.
   *
   * @param message description of the failure
   * @param line markup line that triggered the failure; may be empty
   * @param cause underlying failure
   */
  public TableFormatException(String message, String line, Throwable cause) {
    super(message, cause);
    this.line = line == null ? "" : line;
  }

  /**
   * Returns the markup line that could not be parsed.
   *
   * @return offending line, never {@code null}
   */
  public String line() {
    return line;
  }
}
