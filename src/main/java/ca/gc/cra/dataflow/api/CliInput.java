package ca.gc.cra.dataflow.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw CLI arguments into {@code key=value} tokens and flags such as {@code --help} and {@code --verbose}.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v");

  private final String[] tokens;
  private final Set<String> flags;

  private CliInput(String[] tokens, Set<String> flags) {
    this.tokens = tokens;
    this.flags = flags;
  }

  /**
   * Parses {@code args}; blank and {@code null} entries are ignored.
   *
   * @param args raw arguments
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }
    List<String> tokens = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        tokens.add(arg);
      }
    }
    return new CliInput(tokens.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns the non-flag tokens in their original order.
   *
   * @return copy of the tokens
   */
  public String[] tokens() {
    return Arrays.copyOf(tokens, tokens.length);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
