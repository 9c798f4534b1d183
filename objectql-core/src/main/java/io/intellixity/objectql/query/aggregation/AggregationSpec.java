package io.intellixity.objectql.query.aggregation;

import java.util.Objects;

/**
 * {@code function(field) AS alias}. The per-aggregation {@code distinct} flag is the only way to ask for
 * DISTINCT inside an aggregate; query-level DISTINCT cannot be combined with aggregations.
 */
public record AggregationSpec(AggregateFunction function, String field, String alias, boolean distinct) {
  public AggregationSpec {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(alias, "alias");
  }

  public static AggregationSpec of(AggregateFunction function, String field, String alias) {
    return new AggregationSpec(function, field, alias, false);
  }

  public static AggregationSpec count(String alias) {
    return new AggregationSpec(AggregateFunction.COUNT, null, alias, false);
  }
}
