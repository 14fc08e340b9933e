package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.regex.Pattern;

/** Construction-time identifier checks. Quoting itself is the dialect's job. */
public final class Identifiers {
  private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private Identifiers() {}

  public static String require(String name, String what) {
    if (name == null || name.isBlank()) {
      throw new QueryConstructionException(null, what, what + " name must not be blank");
    }
    if (name.indexOf('\0') >= 0) {
      throw new QueryConstructionException(null, what, what + " name must not contain NUL");
    }
    return name;
  }

  public static String optional(String name, String what) {
    return name == null ? null : require(name, what);
  }

  /** Function names are emitted unquoted, so they are restricted to plain words. */
  public static String function(String name) {
    if (name == null || !FUNCTION_NAME.matcher(name).matches()) {
      throw new QueryConstructionException(null, "function", "invalid function name: " + name);
    }
    return name;
  }
}
