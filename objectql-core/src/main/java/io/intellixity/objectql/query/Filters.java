package io.intellixity.objectql.query;

import java.util.*;

public final class Filters {
  private Filters() {}

  public static Predicate eq(String field, Object value) { return Predicate.of(field, ComparisonOperator.EQ, value); }
  public static Predicate ne(String field, Object value) { return Predicate.of(field, ComparisonOperator.NE, value); }
  public static Predicate gt(String field, Object value) { return Predicate.of(field, ComparisonOperator.GT, value); }
  public static Predicate ge(String field, Object value) { return Predicate.of(field, ComparisonOperator.GE, value); }
  public static Predicate lt(String field, Object value) { return Predicate.of(field, ComparisonOperator.LT, value); }
  public static Predicate le(String field, Object value) { return Predicate.of(field, ComparisonOperator.LE, value); }

  public static Predicate startsWith(String field, String prefix) { return Predicate.of(field, ComparisonOperator.STARTS_WITH, prefix); }
  public static Predicate contains(String field, String text) { return Predicate.of(field, ComparisonOperator.CONTAINS, text); }
  public static Predicate notContains(String field, String text) { return Predicate.of(field, ComparisonOperator.NOT_CONTAINS, text); }

  /** Closed interval {@code [lower, upper]}. */
  public static Predicate between(String field, Object lower, Object upper) {
    return new Predicate(field, ComparisonOperator.BETWEEN, QueryValues.sequence(lower, upper));
  }

  public static Predicate in(String field, Collection<?> values) { return Predicate.of(field, ComparisonOperator.IN, values); }
  public static Predicate notIn(String field, Collection<?> values) { return Predicate.of(field, ComparisonOperator.NOT_IN, values); }

  public static Predicate isNull(String field) { return new Predicate(field, ComparisonOperator.IS_NULL, null); }
  public static Predicate isNotNull(String field) { return new Predicate(field, ComparisonOperator.IS_NOT_NULL, null); }

  /** Column-to-column comparison, e.g. join conditions: {@code eqField("order.customer_id", "c.id")}. */
  public static Predicate eqField(String field, String otherField) {
    return new Predicate(field, ComparisonOperator.EQ, QueryValues.field(otherField));
  }

  public static LogicalGroup and(FilterExpression... operands) {
    return new LogicalGroup(Clause.AND, List.of(operands));
  }

  public static LogicalGroup or(FilterExpression... operands) {
    return new LogicalGroup(Clause.OR, List.of(operands));
  }

  public static NotExpression not(FilterExpression operand) {
    return new NotExpression(operand);
  }
}
