package io.intellixity.objectql.query;

/**
 * Node of a filter expression tree: a {@link Predicate}, an AND/OR {@link LogicalGroup} or a {@link NotExpression}.
 * <p>
 * A bare predicate is a complete expression; composition is always explicit.
 */
public interface FilterExpression {
  <R> R accept(FilterVisitor<R> visitor);
}
