package io.intellixity.sift.query;

import java.util.Objects;

public record Arithmetic(Expr left, Op op, Expr right) implements Expr {
  public enum Op {
    ADD("+"), SUB("-"), MUL("*"), DIV("/");

    private final String symbol;
    Op(String symbol) { this.symbol = symbol; }
    public String symbol() { return symbol; }
  }

  public Arithmetic {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return "(" + left + " " + op.symbol() + " " + right + ")"; }
}
