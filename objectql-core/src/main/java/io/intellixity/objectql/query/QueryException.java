package io.intellixity.objectql.query;

import java.util.Objects;

/** Base for all query IR errors: a closed {@link QueryErrorCode} plus the path of the offending node. */
public abstract class QueryException extends RuntimeException {
  private final QueryErrorCode code;
  private final NodePath path;
  private final String detail;

  protected QueryException(QueryErrorCode code, NodePath path, String detail) {
    super(code + " at " + (path == null ? NodePath.root() : path) + ": " + detail);
    this.code = Objects.requireNonNull(code, "code");
    this.path = (path == null) ? NodePath.root() : path;
    this.detail = detail;
  }

  public QueryErrorCode code() { return code; }
  public QueryErrorCode.Category category() { return code.category(); }
  public NodePath path() { return path; }
  /** Message without the code/path prefix. */
  public String detail() { return detail; }
}
