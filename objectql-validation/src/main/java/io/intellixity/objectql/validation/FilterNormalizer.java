package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Canonical rewrite of a filter tree that does not change its meaning or its validity:
 * nested groups with the same clause are flattened and single-operand groups are replaced by their operand.
 * <p>
 * NOT is kept where it is; De Morgan expansion is left to executors. Unchanged subtrees are returned as the same
 * instances. Flattening uses a worklist, so only clause changes and NOT recurse.
 */
public final class FilterNormalizer {
  private FilterNormalizer() {}

  public static FilterExpression normalize(FilterExpression e) {
    if (e == null) return null;

    FilterExpression x = e;
    while (x instanceof LogicalGroup single && single.operands().size() == 1) x = single.operands().get(0);

    if (x instanceof NotExpression n) {
      FilterExpression child = normalize(n.operand());
      return (child == n.operand()) ? n : new NotExpression(child);
    }

    if (x instanceof LogicalGroup g) {
      List<FilterExpression> in = g.operands();
      List<FilterExpression> flat = flatten(g);
      boolean changed = flat.size() != in.size();
      List<FilterExpression> out = new ArrayList<>(flat.size());
      for (int i = 0; i < flat.size(); i++) {
        FilterExpression c = flat.get(i);
        FilterExpression nc = normalize(c);
        if (nc != c || (!changed && in.get(i) != c)) changed = true;
        out.add(nc);
      }
      return changed ? new LogicalGroup(g.clause(), out) : g;
    }

    return x;
  }

  /**
   * Operands of {@code g} in order, with nested same-clause groups and single-operand groups spliced in. What is
   * left are predicates, NOTs and groups of the other clause with two or more operands.
   */
  static List<FilterExpression> flatten(LogicalGroup g) {
    List<FilterExpression> out = new ArrayList<>(g.operands().size());
    Deque<FilterExpression> work = new ArrayDeque<>();
    pushAll(work, g.operands());
    while (!work.isEmpty()) {
      FilterExpression c = work.pop();
      if (c instanceof LogicalGroup cg && (cg.clause() == g.clause() || cg.operands().size() == 1)) {
        pushAll(work, cg.operands());
      } else {
        out.add(c);
      }
    }
    return out;
  }

  private static void pushAll(Deque<FilterExpression> work, List<FilterExpression> operands) {
    for (int i = operands.size() - 1; i >= 0; i--) work.push(operands.get(i));
  }
}
