package ca.gc.cra.protomine.config;

import ca.gc.cra.protomine.validation.Numbers;
import ca.gc.cra.protomine.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Configuration for one extraction run.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML and defaults so runs against a saved page revision
 * are reproducible.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param input page file, or directory holding {@code <revision>.wiki} files
 * @param revision revision id of the page; required when {@code input} is a directory
 * @param skipMissingTables record packets without a table as skipped instead of aborting the run
 * @param printSchema print every packet's field tree after the summary
 * @param dialect accepted page layout
 * @since 0.1.0
 * @see ca.gc.cra.protomine.application.pipeline.ExtractUseCase
 */
public record ExtractConfig(
    Path input,
    OptionalLong revision,
    boolean skipMissingTables,
    boolean printSchema,
    DialectConfig dialect) {

  /**
   * Normalizes configuration values.
   *
   * @throws IllegalArgumentException if the revision id is not positive
   * @throws NullPointerException if a component is {@code null}
   */
  public ExtractConfig {
    input = Objects.requireNonNull(input, "input").normalize();
    revision = Objects.requireNonNull(revision, "revision");
    if (revision.isPresent()) {
      Numbers.requireRange("revision", revision.getAsLong(), 1, Long.MAX_VALUE);
    }
    dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /**
   * Returns a baseline configuration reading pages from {@code ~/.protomine/pages}.
   *
   * @return default extract configuration
   */
  public static ExtractConfig defaults() {
    return new ExtractConfig(
        defaultBaseDirectory().resolve("pages"),
        OptionalLong.empty(),
        false,
        false,
        DialectConfig.defaults());
  }

  /**
   * Creates a configuration from flattened key/value pairs.
   *
   * @param options keys such as {@code in}, {@code revision}, {@code skipMissingTables}, {@code dialect.*}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid
   */
  public static ExtractConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ExtractConfig defaults = defaults();

    Path input = defaults.input();
    String inRaw = options.get("in");
    if (inRaw != null && !inRaw.isBlank()) {
      input = parsePath("in", inRaw);
    }

    OptionalLong revision = OptionalLong.empty();
    String revisionRaw = options.get("revision");
    if (revisionRaw != null && !revisionRaw.isBlank()) {
      try {
        revision = OptionalLong.of(Long.parseLong(revisionRaw.trim()));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("revision must be a number (was '" + revisionRaw.trim() + "')", ex);
      }
    }

    return new ExtractConfig(
        input,
        revision,
        parseBoolean(options.get("skipMissingTables"), defaults.skipMissingTables()),
        parseBoolean(options.get("printSchema"), defaults.printSchema()),
        DialectConfig.fromMap(options));
  }

  private static Path parsePath(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(sanitized);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + sanitized, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException("expected true or false (was '" + value.trim() + "')");
    }
    return Boolean.parseBoolean(normalized);
  }

  private static Path defaultBaseDirectory() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".protomine");
  }
}
