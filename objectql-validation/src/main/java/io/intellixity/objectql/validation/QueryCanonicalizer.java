package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;

import java.util.*;

/**
 * Rewrites an already validated envelope into canonical form. Defaults are substituted here, once:
 * <ul>
 *   <li>omitted fields become {@code ["*"]}, or the grouped columns for aggregate queries</li>
 *   <li>groupBy is sorted and de-duplicated</li>
 *   <li>repeated scalar columns are dropped (first occurrence wins)</li>
 *   <li>filters are normalized</li>
 *   <li>a zero offset is dropped</li>
 * </ul>
 */
final class QueryCanonicalizer {
  private QueryCanonicalizer() {}

  static QueryEnvelope canonicalize(QueryEnvelope q) {
    List<String> groupBy = new ArrayList<>(new TreeSet<>(q.groupBy()));

    QueryEnvelope.Builder b = q.toBuilder()
        .fields(fields(q, groupBy))
        .where(FilterNormalizer.normalize(q.where()))
        .having(FilterNormalizer.normalize(q.having()))
        .groupBy(groupBy)
        .joins(joins(q.joins()));

    Pagination p = q.pagination();
    if (p instanceof OffsetPagination op && op.offset() != null && op.offset() == 0) {
      b.offset(null);
    }
    return b.build();
  }

  private static List<FieldSelection> fields(QueryEnvelope q, List<String> sortedGroupBy) {
    if (q.fields() != null) return dedupe(q.fields());
    if (!q.isAggregate()) return List.of(FieldSelection.wildcard());
    List<FieldSelection> out = new ArrayList<>(sortedGroupBy.size());
    for (String g : sortedGroupBy) out.add(FieldSelection.scalar(g));
    // aggregate query without grouping: only aggregation outputs are selected
    return out;
  }

  private static List<FieldSelection> dedupe(List<FieldSelection> fields) {
    Set<FieldSelection> seen = new LinkedHashSet<>();
    for (FieldSelection f : fields) {
      if (f instanceof FieldSelection.Relation r) {
        seen.add(new FieldSelection.Relation(r.name(), r.alias(), dedupe(r.subSelections())));
      } else {
        seen.add(f);
      }
    }
    return new ArrayList<>(seen);
  }

  private static List<JoinSpec> joins(List<JoinSpec> joins) {
    List<JoinSpec> out = new ArrayList<>(joins.size());
    for (JoinSpec j : joins) {
      JoinTarget target = j.target();
      if (target instanceof JoinTarget.Subquery s) target = JoinTarget.subquery(canonicalize(s.query()));
      out.add(new JoinSpec(j.type(), target, j.alias(), FilterNormalizer.normalize(j.on())));
    }
    return out;
  }
}
