package ca.gc.cra.logmerge.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys. Derived paths ({@code out},
 * {@code done}) default to blank so they follow {@code in}.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code merge})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "merge" -> buildMergeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildMergeDefaults() {
    MergeConfig defaults = MergeConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", defaults.inputDirectory().toString());
    map.put("out", "");
    map.put("done", "");
    map.put("toleranceSeconds", Long.toString(defaults.tolerance().getSeconds()));
    map.put("outputCharset", defaults.outputCharset().name());
    map.put("secondaryCharset", defaults.secondaryCharset().name());
    map.put("chunkBytes", Integer.toString(defaults.chunkBytes()));
    map.put("groupByLocator", Boolean.toString(defaults.groupByLocator()));
    map.put("archive", Boolean.toString(defaults.archive()));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
