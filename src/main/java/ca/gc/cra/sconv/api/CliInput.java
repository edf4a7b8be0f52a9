package ca.gc.cra.sconv.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Command arguments split into {@code key=value} pairs and bare flags.
 *
 * <p>Flags are lower-cased; {@code -h} and {@code help} are folded into {@code --help}, and
 * {@code -v} and {@code --debug} into {@code --verbose}.</p>
 */
public final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";
  static final String BEST_EFFORT = "--best-effort";

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Splits raw arguments. An argument containing {@code '='} is a pair even when it starts with
   * dashes.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> pairs = new ArrayList<>();
    Set<String> flags = new TreeSet<>();
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      if (arg.contains("=")) {
        pairs.add(arg);
      } else if (arg.startsWith("-") || arg.equalsIgnoreCase("help")) {
        flags.add(canonicalFlag(arg.toLowerCase(Locale.ROOT)));
      } else {
        pairs.add(arg);
      }
    }
    return new CliInput(pairs.toArray(String[]::new), Set.copyOf(flags));
  }

  private static String canonicalFlag(String flag) {
    return switch (flag) {
      case "-h", "help" -> HELP;
      case "-v", "--debug" -> VERBOSE;
      default -> flag;
    };
  }

  /** Copy of the non-flag arguments, command name included. */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /** Whether {@code --best-effort} was given. */
  public boolean bestEffort() {
    return flags.contains(BEST_EFFORT);
  }

  /**
   * Checks whether a flag such as {@code --best-effort} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(canonicalFlag(flag.trim().toLowerCase(Locale.ROOT)));
  }

  public Set<String> flags() {
    return flags;
  }
}
