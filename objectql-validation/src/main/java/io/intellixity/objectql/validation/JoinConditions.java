package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Syntactic binding check for join conditions. Schema lookup is external, so a condition counts as referencing the
 * joined target when a predicate field, a {@code $field} reference, or a string operand is written as
 * {@code qualifier.column}. The string case covers the tuple shape {@code ["order.customer_id", "=", "c.id"]}.
 */
final class JoinConditions {
  private JoinConditions() {}

  static boolean references(FilterExpression on, String qualifier) {
    String prefix = qualifier + ".";
    Deque<FilterExpression> work = new ArrayDeque<>();
    work.push(on);
    while (!work.isEmpty()) {
      FilterExpression e = work.pop();
      if (e instanceof Predicate p) {
        if (binds(p, prefix)) return true;
      } else if (e instanceof LogicalGroup g) {
        g.operands().forEach(work::push);
      } else if (e instanceof NotExpression n) {
        work.push(n.operand());
      }
    }
    return false;
  }

  private static boolean binds(Predicate p, String prefix) {
    if (p.field().startsWith(prefix)) return true;
    QueryValue v = p.value();
    if (v instanceof QueryValue.FieldRef r) return r.path().startsWith(prefix);
    if (v instanceof QueryValue.StringValue s) return s.value().startsWith(prefix);
    return false;
  }
}
