package io.intellixity.relata.expression;

public enum ArithmeticOperator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  MODULO("%"),
  /** String concatenation; spelled by the dialect. */
  CONCAT("||");

  private final String symbol;

  ArithmeticOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }
}
