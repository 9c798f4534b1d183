package io.intellixity.objectql.query;

import java.util.Objects;

/** Leaf comparison {@code field operator value}. Value shape is checked by the validator, not here. */
public final class Predicate implements FilterExpression {
  private final String field;
  private final ComparisonOperator operator;
  private final QueryValue value;

  public Predicate(String field, ComparisonOperator operator, QueryValue value) {
    this.field = Objects.requireNonNull(field, "field");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = (value == null) ? QueryValue.NullValue.INSTANCE : value;
  }

  public static Predicate of(String field, ComparisonOperator operator, Object value) {
    return new Predicate(field, operator, QueryValues.of(value));
  }

  public String field() { return field; }
  public ComparisonOperator operator() { return operator; }
  public QueryValue value() { return value; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Predicate p)) return false;
    return field.equals(p.field) && operator == p.operator && value.equals(p.value);
  }

  @Override
  public int hashCode() { return Objects.hash(field, operator, value); }

  @Override
  public String toString() { return "[" + field + ", " + operator.symbol() + ", " + value.unwrap() + "]"; }
}
