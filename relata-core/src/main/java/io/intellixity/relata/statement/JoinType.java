package io.intellixity.relata.statement;

public enum JoinType {
  INNER("JOIN"),
  LEFT("LEFT JOIN"),
  RIGHT("RIGHT JOIN"),
  FULL("FULL OUTER JOIN"),
  CROSS("CROSS JOIN");

  private final String keyword;

  JoinType(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() { return keyword; }
}
