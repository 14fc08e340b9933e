package io.intellixity.relata.sql;

import java.util.Locale;

/**
 * Statement classification, decided before dispatch.\n
 *
 * Row-returning behavior and transaction participation both depend on it.
 */
public enum StatementKind {
  /** SELECT-like: SELECT, WITH, VALUES, EXPLAIN, PRAGMA, SHOW, DESCRIBE. */
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  /** CREATE, ALTER, DROP, TRUNCATE, RENAME. */
  DDL,
  /** BEGIN, COMMIT, ROLLBACK, SAVEPOINT, RELEASE. */
  TRANSACTION,
  OTHER;

  public boolean isDml() {
    return this == INSERT || this == UPDATE || this == DELETE;
  }

  /** Lexical classification of raw SQL by its leading keyword (comments and parentheses skipped). */
  public static StatementKind classify(String sql) {
    if (sql == null) return OTHER;
    String word = leadingKeyword(sql);
    switch (word) {
      case "SELECT": case "WITH": case "VALUES": case "EXPLAIN": case "PRAGMA":
      case "SHOW": case "DESCRIBE": case "TABLE":
        return SELECT;
      case "INSERT": case "REPLACE": case "UPSERT": case "MERGE":
        return INSERT;
      case "UPDATE":
        return UPDATE;
      case "DELETE":
        return DELETE;
      case "CREATE": case "ALTER": case "DROP": case "TRUNCATE": case "RENAME":
        return DDL;
      case "BEGIN": case "START": case "COMMIT": case "END": case "ROLLBACK": case "SAVEPOINT": case "RELEASE":
        return TRANSACTION;
      default:
        return OTHER;
    }
  }

  /** Whether {@code RETURNING} appears as a keyword outside quotes. */
  public static boolean hasReturning(String sql) {
    if (sql == null) return false;
    String upper = stripQuoted(sql).toUpperCase(Locale.ROOT);
    int i = upper.indexOf("RETURNING");
    while (i >= 0) {
      boolean startOk = i == 0 || !Character.isLetterOrDigit(upper.charAt(i - 1)) && upper.charAt(i - 1) != '_';
      int end = i + "RETURNING".length();
      boolean endOk = end >= upper.length() || !Character.isLetterOrDigit(upper.charAt(end)) && upper.charAt(end) != '_';
      if (startOk && endOk) return true;
      i = upper.indexOf("RETURNING", end);
    }
    return false;
  }

  private static String leadingKeyword(String sql) {
    int i = 0;
    int n = sql.length();
    while (i < n) {
      char c = sql.charAt(i);
      if (Character.isWhitespace(c) || c == '(') {
        i++;
      } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        while (i < n && sql.charAt(i) != '\n') i++;
      } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? n : end + 2;
      } else {
        break;
      }
    }
    int start = i;
    while (i < n && Character.isLetter(sql.charAt(i))) i++;
    return sql.substring(start, i).toUpperCase(Locale.ROOT);
  }

  private static String stripQuoted(String sql) {
    StringBuilder out = new StringBuilder(sql.length());
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);
      if (quote != 0) {
        if (ch == quote) quote = 0;
        out.append(' ');
        continue;
      }
      if (ch == '\'' || ch == '"' || ch == '`') {
        quote = ch;
        out.append(' ');
        continue;
      }
      out.append(ch);
    }
    return out.toString();
  }
}
