package io.intellixity.objectql.validation.metadata;

import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.aggregation.AggregationSpec;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;
import io.intellixity.objectql.query.window.WindowFunctionSpec;
import io.intellixity.objectql.validation.CanonicalQuery;

import java.util.*;

/**
 * Resolves every object and field name in a {@link CanonicalQuery} against a {@link MetadataResolver}.
 *
 * Checks:
 * - root object and join target objects
 * - selected columns and relation paths
 * - filter fields and {@code $field} references (where, having, join conditions)
 * - groupBy, orderBy, aggregation and window fields
 *
 * Aggregation/window aliases are output names and never resolved. {@code alias.column} references are resolved
 * against the joined object; columns of subquery joins are derived and left alone (the subquery itself is
 * resolved against its own object). Unknown names throw {@link QueryResolutionException}.
 */
public final class MetadataQueryValidator {
  private final MetadataResolver metadata;

  public MetadataQueryValidator(MetadataResolver metadata) {
    this.metadata = Objects.requireNonNull(metadata, "metadata");
  }

  public void validate(CanonicalQuery query) {
    Objects.requireNonNull(query, "query");
    resolveEnvelope(query.query(), NodePath.root());
  }

  private void resolveEnvelope(QueryEnvelope q, NodePath path) {
    if (!metadata.hasObject(q.object())) {
      throw new QueryResolutionException(QueryErrorCode.UNKNOWN_OBJECT, path.key("object"),
          "Unknown object '" + q.object() + "'");
    }
    Scope scope = new Scope(q);

    for (int i = 0; i < q.joins().size(); i++) {
      JoinSpec j = q.joins().get(i);
      NodePath at = path.key("joins").index(i);
      if (j.target() instanceof JoinTarget.Subquery s) {
        resolveEnvelope(s.query(), at.key("target"));
        scope.qualifiers.put(j.qualifier(), null);
      } else {
        String target = j.target().objectName();
        if (!metadata.hasObject(target)) {
          throw new QueryResolutionException(QueryErrorCode.UNKNOWN_OBJECT, at.key("target"),
              "Unknown object '" + target + "'");
        }
        scope.qualifiers.put(j.qualifier(), target);
      }
    }
    for (int i = 0; i < q.joins().size(); i++) {
      resolveFilter(scope, q.joins().get(i).on(), path.key("joins").index(i).key("on"));
    }

    if (q.fields() != null) resolveSelections(scope, q.fields(), "", path.key("fields"));
    if (q.where() != null) resolveFilter(scope, q.where(), path.key("where"));
    for (int i = 0; i < q.groupBy().size(); i++) {
      resolve(scope, q.groupBy().get(i), path.key("groupBy").index(i));
    }
    if (q.having() != null) resolveFilter(scope, q.having(), path.key("having"));
    for (int i = 0; i < q.orderBy().size(); i++) {
      resolve(scope, q.orderBy().get(i).field(), path.key("orderBy").index(i).key("field"));
    }
    for (int i = 0; i < q.aggregations().size(); i++) {
      AggregationSpec a = q.aggregations().get(i);
      if (a.field() != null) resolve(scope, a.field(), path.key("aggregations").index(i).key("field"));
    }
    for (int i = 0; i < q.windowFunctions().size(); i++) {
      WindowFunctionSpec w = q.windowFunctions().get(i);
      NodePath at = path.key("windowFunctions").index(i);
      if (w.field() != null) resolve(scope, w.field(), at.key("field"));
      List<String> partitionBy = w.over().partitionBy();
      for (int k = 0; k < partitionBy.size(); k++) {
        resolve(scope, partitionBy.get(k), at.key("over").key("partitionBy").index(k));
      }
      List<SortSpec> orderBy = w.over().orderBy();
      for (int k = 0; k < orderBy.size(); k++) {
        resolve(scope, orderBy.get(k).field(), at.key("over").key("orderBy").index(k).key("field"));
      }
    }
  }

  private void resolveSelections(Scope scope, List<FieldSelection> fields, String prefix, NodePath path) {
    for (int i = 0; i < fields.size(); i++) {
      FieldSelection f = fields.get(i);
      NodePath at = path.index(i);
      if (f instanceof FieldSelection.Scalar s && s.isWildcard()) continue;
      String fieldPath = prefix + f.name();
      if (prefix.isEmpty()) {
        resolve(scope, fieldPath, at);
      } else {
        requireField(scope.object, fieldPath, at);
      }
      if (f instanceof FieldSelection.Relation r) {
        resolveSelections(scope, r.subSelections(), fieldPath + ".", at.key("fields"));
      }
    }
  }

  private void resolveFilter(Scope scope, FilterExpression e, NodePath path) {
    e.accept(new FilterVisitor<Void>() {
      private NodePath current = path;

      @Override
      public Void visit(Predicate p) {
        resolve(scope, p.field(), current.key("field"));
        if (p.value() instanceof QueryValue.FieldRef r) resolve(scope, r.path(), current.key("value"));
        return null;
      }

      @Override
      public Void visit(LogicalGroup g) {
        NodePath self = current;
        for (int i = 0; i < g.operands().size(); i++) {
          current = self.key("operands").index(i);
          g.operands().get(i).accept(this);
        }
        current = self;
        return null;
      }

      @Override
      public Void visit(NotExpression n) {
        NodePath self = current;
        current = self.key("operand");
        n.operand().accept(this);
        current = self;
        return null;
      }
    });
  }

  private void resolve(Scope scope, String name, NodePath path) {
    if (name == null || FieldSelection.WILDCARD.equals(name) || scope.outputAliases.contains(name)) return;
    int dot = name.indexOf('.');
    if (dot > 0) {
      String head = name.substring(0, dot);
      String rest = name.substring(dot + 1);
      if (scope.qualifiers.containsKey(head)) {
        String target = scope.qualifiers.get(head);
        if (target != null) requireField(target, rest, path);
        return;
      }
      if (head.equals(scope.object)) {
        requireField(scope.object, rest, path);
        return;
      }
    }
    requireField(scope.object, name, path);
  }

  private void requireField(String object, String fieldPath, NodePath path) {
    if (!metadata.hasField(object, fieldPath)) {
      throw new QueryResolutionException(QueryErrorCode.UNKNOWN_FIELD, path,
          "Unknown field '" + fieldPath + "' on object '" + object + "'");
    }
  }

  private static final class Scope {
    final String object;
    /** join qualifier -> target object, null for subquery targets */
    final Map<String, String> qualifiers = new HashMap<>();
    final Set<String> outputAliases = new HashSet<>();

    Scope(QueryEnvelope q) {
      this.object = q.object();
      for (AggregationSpec a : q.aggregations()) outputAliases.add(a.alias());
      for (WindowFunctionSpec w : q.windowFunctions()) outputAliases.add(w.alias());
    }
  }
}
