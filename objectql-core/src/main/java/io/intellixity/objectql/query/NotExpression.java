package io.intellixity.objectql.query;

import java.util.Objects;

/**
 * Unary NOT over exactly one subtree (a {@link Predicate} or a {@link LogicalGroup}).
 * <p>
 * NOT(group) is kept as is; pushing the negation down is up to the executor.
 */
public final class NotExpression implements FilterExpression {
  private final FilterExpression operand;

  public NotExpression(FilterExpression operand) {
    this.operand = Objects.requireNonNull(operand, "operand");
  }

  public FilterExpression operand() { return operand; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NotExpression n && operand.equals(n.operand);
  }

  @Override
  public int hashCode() { return 31 * operand.hashCode() + 7; }

  @Override
  public String toString() { return "not(" + operand + ")"; }
}
