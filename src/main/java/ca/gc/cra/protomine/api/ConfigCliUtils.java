package ca.gc.cra.protomine.api;

import ca.gc.cra.protomine.config.ConfigMerger;
import ca.gc.cra.protomine.config.DefaultsForMode;
import ca.gc.cra.protomine.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Merges defaults, the optional YAML file named by {@code config=} and CLI overrides.
   *
   * @param mode command name
   * @param cli mutable CLI map; the {@code config} key is consumed
   * @param warn sink for override warnings
   * @return effective configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or invalid, or validation fails
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cli, Consumer<String> warn)
      throws IOException {
    String configPath = extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cli, DefaultsForMode.asFlatMap(mode), warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
