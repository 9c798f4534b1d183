package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.aggregation.AggregationSpec;

import java.util.*;

/**
 * Grouping consistency, checked in this order:
 * <ol>
 *   <li>with aggregations, every selected column is grouped or is an aggregation alias</li>
 *   <li>HAVING needs GROUP BY or aggregations</li>
 *   <li>query-level DISTINCT cannot be combined with aggregations</li>
 * </ol>
 * then each aggregation on its own (field present unless COUNT, aliases unique).
 */
public final class AggregationRules {
  private AggregationRules() {}

  public static void check(QueryEnvelope q, NodePath path) {
    List<AggregationSpec> aggs = q.aggregations();
    Set<String> grouped = new HashSet<>(q.groupBy());

    if (!aggs.isEmpty() && q.fields() != null) {
      Set<String> aliases = new HashSet<>();
      for (AggregationSpec a : aggs) aliases.add(a.alias());
      for (int i = 0; i < q.fields().size(); i++) {
        FieldSelection f = q.fields().get(i);
        boolean ok = grouped.contains(f.name())
            || (f instanceof FieldSelection.Scalar && aliases.contains(f.name()));
        if (!ok) {
          throw new QueryValidationException(QueryErrorCode.UNGROUPED_FIELD_IN_AGGREGATE_QUERY, path.key("fields").index(i),
              "'" + f.name() + "' is neither grouped nor aggregated");
        }
      }
    }

    if (q.having() != null && q.groupBy().isEmpty() && aggs.isEmpty()) {
      throw new QueryValidationException(QueryErrorCode.HAVING_WITHOUT_GROUPING, path.key("having"),
          "having requires groupBy or aggregations");
    }

    if (q.distinct() && !aggs.isEmpty()) {
      throw new QueryValidationException(QueryErrorCode.DISTINCT_WITH_AGGREGATION, path.key("distinct"),
          "use the per-aggregation distinct flag instead of query-level distinct");
    }

    Set<String> seen = new HashSet<>();
    for (int i = 0; i < aggs.size(); i++) {
      AggregationSpec a = aggs.get(i);
      NodePath at = path.key("aggregations").index(i);
      if (a.function().requiresField() && (a.field() == null || a.field().isBlank())) {
        throw new QueryValidationException(QueryErrorCode.MISSING_AGGREGATION_FIELD, at.key("field"),
            a.function().wireName() + " needs a field");
      }
      if (a.alias().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at.key("alias"), "blank alias");
      }
      if (!seen.add(a.alias())) {
        throw new QueryValidationException(QueryErrorCode.DUPLICATE_AGGREGATION_ALIAS, at.key("alias"),
            "aggregation alias '" + a.alias() + "' is used more than once");
      }
    }
  }
}
