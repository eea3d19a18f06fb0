package io.intellixity.sift.query;

public enum Operator {
  EQ("="),
  NE("<>"),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),

  IN("IN"),
  NIN("NOT IN"),

  LIKE("LIKE");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() { return symbol; }

  public boolean isOrdering() {
    return this == GT || this == GE || this == LT || this == LE;
  }

  public boolean isList() {
    return this == IN || this == NIN;
  }
}
