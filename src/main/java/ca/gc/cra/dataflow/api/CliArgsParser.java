package ca.gc.cra.dataflow.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts {@code key=value} tokens into an ordered map, rejecting malformed keys and control characters.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses tokens; later duplicates replace earlier ones.
   *
   * @param tokens {@code key=value} tokens
   * @return ordered key/value map
   * @throws IllegalArgumentException when a token is not {@code key=value} or contains control characters
   */
  public static Map<String, String> toMap(String[] tokens) {
    Map<String, String> map = new LinkedHashMap<>();
    if (tokens == null) {
      return map;
    }
    for (String token : tokens) {
      if (token == null || token.isBlank()) {
        continue;
      }
      int idx = token.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + token + "')");
      }
      String key = token.substring(0, idx).trim();
      String value = token.substring(idx + 1).trim();
      if (!KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (hasControl(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, value);
    }
    return map;
  }

  private static boolean hasControl(String value) {
    return value.chars().anyMatch(Character::isISOControl);
  }
}
