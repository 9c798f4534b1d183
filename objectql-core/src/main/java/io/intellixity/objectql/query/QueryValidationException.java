package io.intellixity.objectql.query;

/**
 * Raised when a query is structurally malformed: an ill-formed node, an inconsistent combination of clauses, or a
 * boundary value that cannot be mapped onto the IR.
 * <p>
 * Thrown at construction time for invariants a node can check on its own (empty AND/OR groups, conflicting
 * pagination modes) and by the validator for everything else.
 */
public final class QueryValidationException extends QueryException {
  public QueryValidationException(QueryErrorCode code, NodePath path, String message) {
    super(code, path, message);
    if (code.category() != QueryErrorCode.Category.STRUCTURAL) {
      throw new IllegalArgumentException("Not a structural error code: " + code);
    }
  }

  public QueryValidationException(QueryErrorCode code, NodePath path, String message, Throwable cause) {
    this(code, path, message);
    initCause(cause);
  }

  public QueryValidationException(QueryErrorCode code, String message) {
    this(code, NodePath.root(), message);
  }

  /** Same error, re-anchored under {@code prefix} (used when a node is validated inside a larger tree). */
  public QueryValidationException under(NodePath prefix) {
    return new QueryValidationException(code(), prefix.resolve(path()), detail());
  }
}
