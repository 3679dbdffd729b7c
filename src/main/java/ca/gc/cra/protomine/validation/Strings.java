package ca.gc.cra.protomine.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by configuration and CLI layers.
 * <p><strong>Why:</strong> Dialect labels and section names are matched exactly against wiki headings, so
 * stray whitespace or control characters in configuration would silently break matching.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise
 * {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated list, trimming entries and validating each with
   * {@link #requireNonBlank(String, String)}.
   *
   * @param name logical parameter name for diagnostics
   * @param value comma-separated entries, e.g. {@code Status, Login}
   * @return immutable list of trimmed entries in input order
   * @throws IllegalArgumentException if the list or any entry is blank
   */
  public static List<String> splitList(String name, String value) {
    String raw = requireNonBlank(name, value);
    List<String> entries = new ArrayList<>();
    for (String part : raw.split(",")) {
      entries.add(requireNonBlank(name + " entry", part));
    }
    return List.copyOf(entries);
  }

  /**
   * Ensures a value is printable ASCII and no longer than {@code maxLength}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum accepted length after trimming
   * @return trimmed input
   * @throws IllegalArgumentException if the value is blank, too long, or holds non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
