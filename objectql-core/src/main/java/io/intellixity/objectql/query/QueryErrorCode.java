package io.intellixity.objectql.query;

/**
 * Closed error taxonomy for query IR problems.
 * <p>
 * {@link Category#STRUCTURAL} codes mean the query is malformed; {@link Category#DOMAIN} codes mean it is well
 * formed but refers to objects or fields the metadata collaborator does not know.
 */
public enum QueryErrorCode {
  EMPTY_LOGICAL_GROUP(Category.STRUCTURAL),
  OPERATOR_ARITY_MISMATCH(Category.STRUCTURAL),
  DUPLICATE_SELECTION_ALIAS(Category.STRUCTURAL),
  UNGROUPED_FIELD_IN_AGGREGATE_QUERY(Category.STRUCTURAL),
  HAVING_WITHOUT_GROUPING(Category.STRUCTURAL),
  DISTINCT_WITH_AGGREGATION(Category.STRUCTURAL),
  MISSING_AGGREGATION_FIELD(Category.STRUCTURAL),
  DUPLICATE_AGGREGATION_ALIAS(Category.STRUCTURAL),
  RANKING_FUNCTION_WITH_FIELD(Category.STRUCTURAL),
  OFFSET_FUNCTION_WITHOUT_FIELD(Category.STRUCTURAL),
  FRAME_WITHOUT_ORDER(Category.STRUCTURAL),
  INVALID_WINDOW_FRAME(Category.STRUCTURAL),
  DUPLICATE_WINDOW_ALIAS(Category.STRUCTURAL),
  DUPLICATE_JOIN_ALIAS(Category.STRUCTURAL),
  JOIN_NESTING_TOO_DEEP(Category.STRUCTURAL),
  JOIN_CONDITION_UNBOUND(Category.STRUCTURAL),
  CONFLICTING_PAGINATION_MODES(Category.STRUCTURAL),
  NEGATIVE_LIMIT(Category.STRUCTURAL),
  NEGATIVE_OFFSET(Category.STRUCTURAL),
  EXPRESSION_NESTING_TOO_DEEP(Category.STRUCTURAL),
  MALFORMED_NODE(Category.STRUCTURAL),

  UNKNOWN_OBJECT(Category.DOMAIN),
  UNKNOWN_FIELD(Category.DOMAIN);

  public enum Category { STRUCTURAL, DOMAIN }

  private final Category category;

  QueryErrorCode(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }
}
