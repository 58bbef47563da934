package io.b2mash.maxify.util;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching for names: {@code *} matches any run of characters, {@code ?}
 * matches exactly one. Matching ignores case. Every other character is literal.
 */
public final class NamePattern implements Predicate<String> {

  private static final NamePattern ANY = new NamePattern("*");

  private final String glob;
  private final Pattern regex;

  private NamePattern(String glob) {
    this.glob = glob;
    this.regex = Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  /** Compiles a pattern; a {@code null} or blank pattern matches every name. */
  public static NamePattern of(String glob) {
    if (glob == null || glob.isBlank()) {
      return ANY;
    }
    return new NamePattern(glob.trim());
  }

  @Override
  public boolean test(String name) {
    return name != null && regex.matcher(name).matches();
  }

  private static String toRegex(String glob) {
    var regex = new StringBuilder();
    var literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (!literal.isEmpty()) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (!literal.isEmpty()) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return regex.toString();
  }

  @Override
  public String toString() {
    return glob;
  }
}
