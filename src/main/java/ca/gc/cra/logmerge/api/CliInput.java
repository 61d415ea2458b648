package ca.gc.cra.logmerge.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and {@code key=value} pairs.
 *
 * <p>Short aliases are normalized to their long form: {@code -h}/{@code help} to {@code --help}, {@code -v} to
 * {@code --verbose} and {@code -n} to {@code --dry-run}.</p>
 */
public final class CliInput {
  private static final Map<String, String> ALIASES = Map.of(
      "-h", "--help",
      "help", "--help",
      "-v", "--verbose",
      "--debug", "--verbose",
      "-n", "--dry-run");

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments into flag and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (ALIASES.containsKey(lower)) {
        flags.add(ALIASES.get(lower));
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments, usually {@code key=value} pairs.
   *
   * @return copy of the remaining arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when {@code --verbose} or an alias was present
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a normalized flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns all normalized flags supplied on the command line.
   *
   * @return set of normalized flags (lowercase)
   */
  public Set<String> flags() {
    return flags;
  }
}
