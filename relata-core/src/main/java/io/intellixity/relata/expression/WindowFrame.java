package io.intellixity.relata.expression;

import java.util.Objects;

/** {@code ROWS|RANGE BETWEEN start AND end}. Offsets are structural integers, not user values. */
public record WindowFrame(Mode mode, Bound start, Bound end) {
  public WindowFrame {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }

  public static WindowFrame rows(Bound start, Bound end) { return new WindowFrame(Mode.ROWS, start, end); }
  public static WindowFrame range(Bound start, Bound end) { return new WindowFrame(Mode.RANGE, start, end); }

  public enum Mode { ROWS, RANGE }

  public enum BoundKind { UNBOUNDED_PRECEDING, PRECEDING, CURRENT_ROW, FOLLOWING, UNBOUNDED_FOLLOWING }

  public record Bound(BoundKind kind, long offset) {
    public Bound {
      Objects.requireNonNull(kind, "kind");
      if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    }

    public static Bound unboundedPreceding() { return new Bound(BoundKind.UNBOUNDED_PRECEDING, 0); }
    public static Bound preceding(long n) { return new Bound(BoundKind.PRECEDING, n); }
    public static Bound currentRow() { return new Bound(BoundKind.CURRENT_ROW, 0); }
    public static Bound following(long n) { return new Bound(BoundKind.FOLLOWING, n); }
    public static Bound unboundedFollowing() { return new Bound(BoundKind.UNBOUNDED_FOLLOWING, 0); }
  }
}
