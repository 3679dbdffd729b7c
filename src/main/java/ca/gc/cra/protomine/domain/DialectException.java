package ca.gc.cra.protomine.domain;

/**
 * Raised when wiki markup no longer matches the page layout the miner understands.
 *
 * <p>Missing header cells, an identifier without a protocol value, or a section name outside the
 * configured lists all mean the source changed shape. The run must stop so the dialect
 * configuration or the markup can be fixed.</p>
 *
 * @since 0.1.0
 */
public class DialectException extends ProtomineException {
  private static final long serialVersionUID = 1L;

  private final String sectionName;

  /**
   * Creates an exception tied to the section being processed.
   *
   * @param sectionName name of the packet or section whose markup is unexpected
   * @param message description of the mismatch
   */
  public DialectException(String sectionName, String message) {
    super(message + " [section: " + sectionName + ']');
    this.sectionName = sectionName;
  }

  /**
   * Returns the name of the packet or section that failed.
   *
   * @return section name
   */
  public String sectionName() {
    return sectionName;
  }
}
