package ca.gc.cra.logmerge.api;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers for mixing CLI flags with map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} entry so it never reaches the merged settings.
   *
   * @param args mutable CLI map
   * @return trimmed path or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Reads a flag that may be set either on the command line ({@code --allow-overwrite}) or as a setting
   * ({@code allowOverwrite=true}).
   *
   * @param input parsed CLI input
   * @param flag long flag name
   * @param settings merged settings
   * @param key settings key
   * @return {@code true} when either source enables it
   */
  static boolean flagOrSetting(CliInput input, String flag, Map<String, String> settings, String key) {
    if (input.hasFlag(flag)) {
      return true;
    }
    String value = settings == null ? null : settings.get(key);
    if (value == null) {
      return false;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      default -> false;
    };
  }
}
