package io.intellixity.objectql.query;

import java.util.*;

/** AND/OR over one or more operands. Empty groups are rejected here rather than read as an identity. */
public final class LogicalGroup implements FilterExpression {
  private final Clause clause;
  private final List<FilterExpression> operands;

  public LogicalGroup(Clause clause, List<? extends FilterExpression> operands) {
    this.clause = Objects.requireNonNull(clause, "clause");
    if (operands == null || operands.isEmpty()) {
      throw new QueryValidationException(QueryErrorCode.EMPTY_LOGICAL_GROUP,
          clause.wireName() + " group needs at least one operand");
    }
    for (FilterExpression e : operands) Objects.requireNonNull(e, "operand");
    this.operands = List.copyOf(operands);
  }

  public Clause clause() { return clause; }
  public List<FilterExpression> operands() { return operands; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup g)) return false;
    return clause == g.clause && operands.equals(g.operands);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, operands); }

  @Override
  public String toString() { return clause.wireName() + operands; }
}
