package ca.gc.cra.protomine.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each protomine CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target CLI command (extract, shape)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the command is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "extract" -> buildExtractDefaults();
      case "shape" -> buildShapeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildExtractDefaults() {
    ExtractConfig defaults = ExtractConfig.defaults();
    DialectConfig dialect = defaults.dialect();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", defaults.input().toString());
    map.put("skipMissingTables", Boolean.toString(defaults.skipMissingTables()));
    map.put("printSchema", Boolean.toString(defaults.printSchema()));
    map.put("dialect.states", String.join(",", dialect.states()));
    map.put("dialect.ignored", String.join(",", dialect.ignoredSections()));
    map.put("dialect.directions", String.join(",", dialect.directions()));
    map.put("dialect.noFieldsMarker", dialect.noFieldsMarker());
    map.put("dialect.packetIdHeader", dialect.packetIdHeader());
    map.put("dialect.fieldNameHeader", dialect.fieldNameHeader());
    map.put("dialect.fieldTypeHeader", dialect.fieldTypeHeader());
    map.put("dialect.maxNestingDepth", Integer.toString(dialect.maxNestingDepth()));
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildShapeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("table", "1");
    map.put("columnWidth", "5");
    map.put("rowHeight", "2");
    return map;
  }
}
