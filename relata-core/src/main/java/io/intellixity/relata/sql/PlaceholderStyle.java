package io.intellixity.relata.sql;

/** How a dialect spells the Nth bind parameter. */
public enum PlaceholderStyle {
  /** {@code ?} */
  QMARK,
  /** {@code $1}, {@code $2}, ... */
  NUMBERED,
  /** {@code :p1}, {@code :p2}, ... */
  NAMED;

  public String placeholder(int position1Based) {
    if (position1Based <= 0) throw new IllegalArgumentException("position1Based must be >= 1");
    switch (this) {
      case NUMBERED: return "$" + position1Based;
      case NAMED: return ":p" + position1Based;
      default: return "?";
    }
  }
}
