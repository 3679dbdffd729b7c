package ca.gc.cra.protomine.config;

import ca.gc.cra.protomine.domain.schema.SchemaInferenceEngine;
import ca.gc.cra.protomine.validation.Numbers;
import ca.gc.cra.protomine.validation.Strings;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Describes the wiki page layout the extractor accepts.
 * <p><strong>Why:</strong> The protocol page changes between revisions; section names, header labels and
 * the "no fields" marker are kept here so dialect drift is handled by configuration, not code.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param states top-level sections holding packets (protocol states)
 * @param ignoredSections top-level sections skipped without error
 * @param directions allowed names of the subsections of a state
 * @param noFieldsMarker field-name cell content marking a packet without fields
 * @param packetIdHeader expected content of the table's top-left cell
 * @param fieldNameHeader header label of the field-name columns
 * @param fieldTypeHeader header label of the field-type columns
 * @param maxNestingDepth maximum composite nesting accepted by the inference
 * @since 0.1.0
 */
public record DialectConfig(
    List<String> states,
    List<String> ignoredSections,
    List<String> directions,
    String noFieldsMarker,
    String packetIdHeader,
    String fieldNameHeader,
    String fieldTypeHeader,
    int maxNestingDepth) {
  static final int MAX_NESTING_LIMIT = 256;

  /**
   * Normalizes values and rejects inconsistent lists.
   *
   * @throws IllegalArgumentException if a label is blank, a list is empty, a state is also ignored,
   *     or the nesting limit is out of range
   */
  public DialectConfig {
    states = nonEmpty("states", states);
    ignoredSections = List.copyOf(Objects.requireNonNull(ignoredSections, "ignoredSections"));
    directions = nonEmpty("directions", directions);
    noFieldsMarker = Strings.requireNonBlank("noFieldsMarker", noFieldsMarker);
    packetIdHeader = Strings.requireNonBlank("packetIdHeader", packetIdHeader);
    fieldNameHeader = Strings.requireNonBlank("fieldNameHeader", fieldNameHeader);
    fieldTypeHeader = Strings.requireNonBlank("fieldTypeHeader", fieldTypeHeader);
    Numbers.requireRange("maxNestingDepth", maxNestingDepth, 1, MAX_NESTING_LIMIT);

    Set<String> overlap = new HashSet<>(states);
    overlap.retainAll(ignoredSections);
    if (!overlap.isEmpty()) {
      throw new IllegalArgumentException("sections cannot be both states and ignored: " + overlap);
    }
  }

  /**
   * Returns the layout of the protocol documentation page.
   *
   * @return default dialect
   */
  public static DialectConfig defaults() {
    return new DialectConfig(
        List.of("Handshaking", "Status", "Login", "Configuration", "Play"),
        List.of("Definitions", "Packet format", "Navigation"),
        List.of("Clientbound", "Serverbound"),
        SchemaInferenceEngine.DEFAULT_NO_FIELDS_MARKER,
        "Packet ID",
        "Field Name",
        "Field Type",
        SchemaInferenceEngine.DEFAULT_MAX_NESTING_DEPTH);
  }

  /**
   * Creates a dialect from flattened {@code dialect.*} keys, falling back to {@link #defaults()}.
   *
   * @param options flattened configuration, e.g. {@code dialect.states=Status,Login}
   * @return populated dialect
   * @throws IllegalArgumentException when values are invalid
   */
  public static DialectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    DialectConfig defaults = defaults();
    return new DialectConfig(
        list(options, "dialect.states", defaults.states()),
        ignoredList(options, defaults.ignoredSections()),
        list(options, "dialect.directions", defaults.directions()),
        text(options, "dialect.noFieldsMarker", defaults.noFieldsMarker()),
        text(options, "dialect.packetIdHeader", defaults.packetIdHeader()),
        text(options, "dialect.fieldNameHeader", defaults.fieldNameHeader()),
        text(options, "dialect.fieldTypeHeader", defaults.fieldTypeHeader()),
        depth(options, defaults.maxNestingDepth()));
  }

  /**
   * Returns whether {@code name} is a packet-holding state.
   *
   * @param name top-level section name
   * @return {@code true} when listed in {@link #states()}
   */
  public boolean isState(String name) {
    return states.contains(name);
  }

  /**
   * Returns whether {@code name} is a top-level section to skip.
   *
   * @param name top-level section name
   * @return {@code true} when listed in {@link #ignoredSections()}
   */
  public boolean isIgnored(String name) {
    return ignoredSections.contains(name);
  }

  /**
   * Returns whether {@code name} is an allowed direction subsection.
   *
   * @param name subsection name
   * @return {@code true} when listed in {@link #directions()}
   */
  public boolean isDirection(String name) {
    return directions.contains(name);
  }

  private static List<String> nonEmpty(String name, List<String> values) {
    List<String> copy = List.copyOf(Objects.requireNonNull(values, name));
    if (copy.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
    return copy;
  }

  private static List<String> list(Map<String, String> options, String key, List<String> fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : Strings.splitList(key, raw);
  }

  private static List<String> ignoredList(Map<String, String> options, List<String> fallback) {
    String key = "dialect.ignored";
    if (!options.containsKey(key)) {
      return fallback;
    }
    String raw = options.get(key);
    // An explicit blank value clears the ignore list.
    return raw == null || raw.isBlank() ? List.of() : Strings.splitList(key, raw);
  }

  private static String text(Map<String, String> options, String key, String fallback) {
    String raw = options.get(key);
    return raw == null || raw.isBlank() ? fallback : raw;
  }

  private static int depth(Map<String, String> options, int fallback) {
    String raw = options.get("dialect.maxNestingDepth");
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseInt("dialect.maxNestingDepth", raw, 1, MAX_NESTING_LIMIT);
  }
}
