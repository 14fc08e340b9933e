package io.intellixity.relata.jdbc;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.sql.Bind;
import io.intellixity.relata.sql.PlaceholderStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites dialect placeholders ({@code $n}, {@code :pn}) into JDBC {@code ?} binds.\n
 *
 * Rules:
 * - {@code $n} / {@code :pn} refer to the nth bind (1-based); binds are re-ordered (and repeated)
 *   to match their appearance in the text.\n
 * - Text inside single quotes, double quotes and line comments is copied untouched.\n
 * - {@code ::} is a cast, and {@code $tag$ ... $tag$} is a dollar-quoted string.\n
 *
 * {@link PlaceholderStyle#QMARK} SQL is returned as-is.
 */
public final class JdbcPlaceholderCompiler {
  private JdbcPlaceholderCompiler() {}

  public record Compiled(String sql, List<Bind> binds) {
    public Compiled {
      binds = List.copyOf(binds);
    }
  }

  public static Compiled compile(String sql, List<Bind> binds, PlaceholderStyle style) {
    if (sql == null) throw new IllegalArgumentException("sql is required");
    List<Bind> in = binds == null ? List.of() : binds;
    if (style == null || style == PlaceholderStyle.QMARK) return new Compiled(sql, in);

    StringBuilder out = new StringBuilder(sql.length());
    List<Bind> ordered = new ArrayList<>(in.size());
    int n = sql.length();
    int i = 0;
    while (i < n) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        int end = closingQuote(sql, i, ch);
        out.append(sql, i, end);
        i = end;
        continue;
      }
      if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
        int end = sql.indexOf('\n', i);
        end = end < 0 ? n : end;
        out.append(sql, i, end);
        i = end;
        continue;
      }

      if (style == PlaceholderStyle.NUMBERED && ch == '$') {
        int digitsEnd = digits(sql, i + 1);
        if (digitsEnd > i + 1) {
          ordered.add(bindAt(in, sql.substring(i + 1, digitsEnd), sql));
          out.append('?');
          i = digitsEnd;
          continue;
        }
        int end = dollarQuoted(sql, i);
        out.append(sql, i, end);
        i = end;
        continue;
      }

      if (style == PlaceholderStyle.NAMED && ch == ':') {
        if (i + 1 < n && sql.charAt(i + 1) == ':') {
          out.append("::");
          i += 2;
          continue;
        }
        if (i + 1 < n && sql.charAt(i + 1) == 'p') {
          int digitsEnd = digits(sql, i + 2);
          if (digitsEnd > i + 2) {
            ordered.add(bindAt(in, sql.substring(i + 2, digitsEnd), sql));
            out.append('?');
            i = digitsEnd;
            continue;
          }
        }
      }

      out.append(ch);
      i++;
    }
    return new Compiled(out.toString(), ordered);
  }

  private static Bind bindAt(List<Bind> binds, String number, String sql) {
    int idx = Integer.parseInt(number);
    if (idx < 1 || idx > binds.size()) {
      throw new QueryConstructionException("placeholder " + number + " has no bind (bindCount=" + binds.size()
          + ", sqlLen=" + sql.length() + ")");
    }
    return binds.get(idx - 1);
  }

  private static int digits(String sql, int from) {
    int i = from;
    while (i < sql.length() && Character.isDigit(sql.charAt(i))) i++;
    return i;
  }

  /** Index just past the closing quote; doubled quotes are escapes. */
  private static int closingQuote(String sql, int start, char quote) {
    int i = start + 1;
    while (i < sql.length()) {
      if (sql.charAt(i) == quote) {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    return sql.length();
  }

  /** Index just past a {@code $tag$...$tag$} string, or past the lone '$' when it opens none. */
  private static int dollarQuoted(String sql, int start) {
    int tagEnd = start + 1;
    while (tagEnd < sql.length() && (Character.isLetterOrDigit(sql.charAt(tagEnd)) || sql.charAt(tagEnd) == '_')) {
      tagEnd++;
    }
    if (tagEnd >= sql.length() || sql.charAt(tagEnd) != '$') return start + 1;
    String tag = sql.substring(start, tagEnd + 1);
    int close = sql.indexOf(tag, tagEnd + 1);
    return close < 0 ? sql.length() : close + tag.length();
  }
}
