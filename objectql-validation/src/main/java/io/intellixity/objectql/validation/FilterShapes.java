package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;

import java.util.*;

/**
 * Recursive shape check of a filter tree: every predicate's value must fit its operator and the tree must stay
 * within the nesting guard.
 *
 * <p>Nesting is measured on the normalized tree (same-clause groups and single-operand groups do not add a
 * level), so normalizing a filter never changes whether it passes. Those transparent groups are walked with a
 * worklist, so recursion only follows levels the guard counts.</p>
 */
public final class FilterShapes {
  private FilterShapes() {}

  public static void check(FilterExpression e, NodePath path, int maxDepth) {
    try {
      walk(e, 0, maxDepth);
    } catch (QueryValidationException ex) {
      throw path.isRoot() ? ex : ex.under(path);
    }
  }

  /** Errors thrown from here carry paths relative to {@code e}. */
  private static void walk(FilterExpression e, int depth, int maxDepth) {
    Step at = new Step(e, null, 0);
    while (at.expr() instanceof LogicalGroup single && single.operands().size() == 1) {
      at = new Step(single.operands().get(0), at, 0);
    }
    FilterExpression x = at.expr();

    if (x instanceof Predicate p) {
      try {
        checkPredicate(p, NodePath.root());
      } catch (QueryValidationException ex) {
        throw ex.under(at.path());
      }
      return;
    }

    if (x instanceof NotExpression n) {
      requireDepth(depth + 1, maxDepth, at.path());
      try {
        walk(n.operand(), depth + 1, maxDepth);
      } catch (QueryValidationException ex) {
        throw ex.under(at.path().key("operand"));
      }
      return;
    }

    if (x instanceof LogicalGroup g) {
      int d = depth + 1;
      requireDepth(d, maxDepth, at.path());
      Deque<Step> work = new ArrayDeque<>();
      push(work, g, at);
      while (!work.isEmpty()) {
        Step s = work.pop();
        if (s.expr() instanceof LogicalGroup c && (c.clause() == g.clause() || c.operands().size() == 1)) {
          push(work, c, s);
          continue;
        }
        try {
          walk(s.expr(), d, maxDepth);
        } catch (QueryValidationException ex) {
          throw ex.under(s.path());
        }
      }
      return;
    }

    throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at.path(),
        "Unsupported FilterExpression: " + x.getClass().getName());
  }

  /** Pushes operands so they pop in order. */
  private static void push(Deque<Step> work, LogicalGroup g, Step parent) {
    List<FilterExpression> ops = g.operands();
    for (int i = ops.size() - 1; i >= 0; i--) work.push(new Step(ops.get(i), parent, i));
  }

  private static void requireDepth(int depth, int maxDepth, NodePath path) {
    if (depth > maxDepth) {
      throw new QueryValidationException(QueryErrorCode.EXPRESSION_NESTING_TOO_DEEP, path,
          "filter nests deeper than " + maxDepth + " levels");
    }
  }

  /** Worklist entry; the path is only built when an error needs it. */
  private record Step(FilterExpression expr, Step parent, int index) {
    NodePath path() {
      List<Object> segments = new ArrayList<>();
      for (Step s = this; s.parent != null; s = s.parent) {
        segments.add(s.index);
        segments.add("operands");
      }
      Collections.reverse(segments);
      return NodePath.of(segments.toArray());
    }
  }

  static void checkPredicate(Predicate p, NodePath path) {
    if (p.field().isBlank()) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("field"), "blank field in predicate");
    }
    ComparisonOperator op = p.operator();
    QueryValue v = p.value();
    NodePath at = path.key("value");
    switch (op.shape()) {
      case EQUALITY -> {
        if (v instanceof QueryValue.SequenceValue || v instanceof QueryValue.MapValue) {
          throw arity(op, at, "a single value");
        }
      }
      case ORDERED -> {
        if (!(v instanceof QueryValue.NumberValue || v instanceof QueryValue.StringValue || v instanceof QueryValue.FieldRef)) {
          throw arity(op, at, "a number, string or field reference");
        }
      }
      case TEXT -> {
        if (!(v instanceof QueryValue.StringValue)) throw arity(op, at, "a string");
      }
      case PAIR -> {
        if (!(v instanceof QueryValue.SequenceValue bounds) || bounds.size() != 2) {
          throw arity(op, at, "exactly two bounds");
        }
        for (QueryValue b : bounds.items()) {
          if (b.isNull() || b instanceof QueryValue.SequenceValue || b instanceof QueryValue.MapValue) {
            throw arity(op, at, "two scalar bounds");
          }
        }
      }
      case NON_EMPTY_SEQUENCE -> {
        if (!(v instanceof QueryValue.SequenceValue items) || items.size() == 0) {
          throw arity(op, at, "a non-empty list");
        }
      }
      case NONE -> {
        if (!v.isNull()) throw arity(op, at, "no value");
      }
    }
  }

  private static QueryValidationException arity(ComparisonOperator op, NodePath path, String expected) {
    return new QueryValidationException(QueryErrorCode.OPERATOR_ARITY_MISMATCH, path,
        "operator '" + op.symbol() + "' expects " + expected);
  }
}
