package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.FieldSelection;
import io.intellixity.objectql.query.QueryEnvelope;
import io.intellixity.objectql.query.json.QueryJson;

import java.util.Objects;

/**
 * A validated, normalized query. Only {@link QueryValidator} creates these.
 * <p>
 * Two envelopes that differ only syntactically (duplicate scalar columns, group-by order, redundant groups, zero
 * offsets) produce equal canonical queries with equal {@link #cacheKey()}s.
 */
public final class CanonicalQuery {
  private final QueryEnvelope query;
  private volatile String cacheKey;

  CanonicalQuery(QueryEnvelope query) {
    this.query = Objects.requireNonNull(query, "query");
  }

  public QueryEnvelope query() { return query; }

  /** True when the select list is the explicit "all scalar fields" wildcard. */
  public boolean selectsAllScalarFields() {
    return query.fields() != null
        && query.fields().size() == 1
        && query.fields().get(0) instanceof FieldSelection.Scalar s
        && s.isWildcard();
  }

  /** Canonical JSON text; stable across runs, suitable as a memoization key. */
  public String cacheKey() {
    String k = cacheKey;
    if (k == null) {
      k = QueryJson.toJson(query);
      cacheKey = k;
    }
    return k;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CanonicalQuery c && query.equals(c.query);
  }

  @Override
  public int hashCode() { return query.hashCode(); }

  @Override
  public String toString() { return "CanonicalQuery" + cacheKey(); }
}
