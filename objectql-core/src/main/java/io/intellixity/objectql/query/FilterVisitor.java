package io.intellixity.objectql.query;

public interface FilterVisitor<R> {
  R visit(Predicate predicate);
  R visit(LogicalGroup group);
  R visit(NotExpression not);
}
