package io.intellixity.objectql.validation.metadata;

import io.intellixity.objectql.query.NodePath;
import io.intellixity.objectql.query.QueryErrorCode;
import io.intellixity.objectql.query.QueryException;

/**
 * Raised when a well-formed query refers to an object or field the metadata service does not know.
 * Kept apart from {@link io.intellixity.objectql.query.QueryValidationException} so callers can tell "malformed
 * query" from "unknown name".
 */
public final class QueryResolutionException extends QueryException {
  public QueryResolutionException(QueryErrorCode code, NodePath path, String message) {
    super(code, path, message);
    if (code.category() != QueryErrorCode.Category.DOMAIN) {
      throw new IllegalArgumentException("Not a domain error code: " + code);
    }
  }
}
