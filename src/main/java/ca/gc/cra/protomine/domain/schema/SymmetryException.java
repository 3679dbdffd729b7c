package ca.gc.cra.protomine.domain.schema;

import ca.gc.cra.protomine.domain.ProtomineException;

/**
 * Raised when the field-name and field-type columns do not describe the same rows.
 *
 * <p>Either the table uses a layout the inference does not support or an editor broke the markup.
 * Callers may skip the affected packet and continue.</p>
 *
 * @since 0.1.0
 */
public class SymmetryException extends ProtomineException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception describing the asymmetry.
   *
   * @param message description including the offending row or field
   */
  public SymmetryException(String message) {
    super(message);
  }
}
