package ca.gc.cra.protomine.domain;

/**
 * Base type for failures raised while turning wiki markup into packet schemas.
 *
 * <p>Subtypes distinguish malformed table markup, name/type asymmetry, and dialect drift so callers
 * can decide which failures abort a single packet and which abort the whole run.</p>
 *
 * @since 0.1.0
 */
public class ProtomineException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message human readable description naming the offending input
   */
  public ProtomineException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and underlying cause.
   *
   * @param message human readable description naming the offending input
   * @param cause underlying failure
   */
  public ProtomineException(String message, Throwable cause) {
    super(message, cause);
  }
}
