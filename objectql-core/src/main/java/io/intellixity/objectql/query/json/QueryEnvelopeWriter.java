package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.aggregation.AggregationSpec;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;
import io.intellixity.objectql.query.window.WindowFrame;
import io.intellixity.objectql.query.window.WindowFunctionSpec;
import io.intellixity.objectql.query.window.WindowSpec;

import java.util.List;
import java.util.TreeMap;

/**
 * Writes the canonical wire form. Key order is fixed, map-valued entries (cursor, map literals) are written in
 * key order and empty/default parts are omitted, so equal envelopes always produce identical JSON.
 */
public final class QueryEnvelopeWriter {

  public ObjectNode write(QueryEnvelope q) {
    ObjectNode o = JsonValues.NODES.objectNode();
    o.put("object", q.object());

    if (q.fields() != null) o.set("fields", selections(q.fields()));
    if (q.where() != null) o.set("where", filter(q.where()));

    if (!q.joins().isEmpty()) {
      ArrayNode a = o.putArray("joins");
      for (JoinSpec j : q.joins()) a.add(join(j));
    }

    if (!q.groupBy().isEmpty()) strings(o.putArray("groupBy"), q.groupBy());
    if (q.having() != null) o.set("having", filter(q.having()));
    if (!q.orderBy().isEmpty()) o.set("orderBy", sorts(q.orderBy()));

    if (!q.windowFunctions().isEmpty()) {
      ArrayNode a = o.putArray("windowFunctions");
      for (WindowFunctionSpec w : q.windowFunctions()) a.add(windowFunction(w));
    }

    if (!q.aggregations().isEmpty()) {
      ArrayNode a = o.putArray("aggregations");
      for (AggregationSpec s : q.aggregations()) a.add(aggregation(s));
    }

    if (q.distinct()) o.put("distinct", true);

    Pagination p = q.pagination();
    if (p != null) {
      if (p.limit() != null) o.put("limit", p.limit());
      if (p instanceof OffsetPagination op && op.offset() != null) o.put("offset", op.offset());
      if (p instanceof CursorPagination cp) {
        ObjectNode c = o.putObject("cursor");
        new TreeMap<>(cp.cursor()).forEach((k, v) -> c.set(k, JsonValues.toJson(v)));
      }
    }
    return o;
  }

  /** Canonical array form of a filter tree. */
  public JsonNode filter(FilterExpression e) {
    return e.accept(new FilterVisitor<JsonNode>() {
      @Override
      public JsonNode visit(Predicate p) {
        ArrayNode a = JsonValues.NODES.arrayNode();
        a.add(p.field());
        a.add(p.operator().symbol());
        a.add(JsonValues.toJson(p.value()));
        return a;
      }

      @Override
      public JsonNode visit(LogicalGroup g) {
        ArrayNode a = JsonValues.NODES.arrayNode();
        a.add(g.clause().wireName());
        for (FilterExpression x : g.operands()) a.add(x.accept(this));
        return a;
      }

      @Override
      public JsonNode visit(NotExpression n) {
        ArrayNode a = JsonValues.NODES.arrayNode();
        a.add("not");
        a.add(n.operand().accept(this));
        return a;
      }
    });
  }

  private ArrayNode selections(List<FieldSelection> fields) {
    ArrayNode a = JsonValues.NODES.arrayNode();
    for (FieldSelection f : fields) {
      if (f instanceof FieldSelection.Relation r) {
        ObjectNode o = a.addObject();
        o.put("field", r.name());
        if (r.alias() != null) o.put("alias", r.alias());
        if (!r.subSelections().isEmpty()) o.set("fields", selections(r.subSelections()));
      } else {
        a.add(f.name());
      }
    }
    return a;
  }

  private ObjectNode join(JoinSpec j) {
    ObjectNode o = JsonValues.NODES.objectNode();
    o.put("type", j.type().wireName());
    o.put("object", j.target().objectName());
    if (j.target() instanceof JoinTarget.Subquery s) o.set("subquery", write(s.query()));
    if (j.alias() != null) o.put("alias", j.alias());
    o.set("on", filter(j.on()));
    return o;
  }

  private ArrayNode sorts(List<SortSpec> sorts) {
    ArrayNode a = JsonValues.NODES.arrayNode();
    for (SortSpec s : sorts) {
      ObjectNode o = a.addObject();
      o.put("field", s.field());
      o.put("order", s.direction().wireName());
    }
    return a;
  }

  private ObjectNode aggregation(AggregationSpec s) {
    ObjectNode o = JsonValues.NODES.objectNode();
    o.put("function", s.function().wireName());
    if (s.field() != null) o.put("field", s.field());
    o.put("alias", s.alias());
    if (s.distinct()) o.put("distinct", true);
    return o;
  }

  private ObjectNode windowFunction(WindowFunctionSpec w) {
    ObjectNode o = JsonValues.NODES.objectNode();
    o.put("function", w.function().wireName());
    if (w.field() != null) o.put("field", w.field());
    o.put("alias", w.alias());
    WindowSpec over = w.over();
    ObjectNode ov = o.putObject("over");
    if (!over.partitionBy().isEmpty()) strings(ov.putArray("partitionBy"), over.partitionBy());
    if (!over.orderBy().isEmpty()) ov.set("orderBy", sorts(over.orderBy()));
    WindowFrame f = over.frame();
    if (f != null) {
      ObjectNode fo = ov.putObject("frame");
      fo.put("type", f.mode().name().toLowerCase(java.util.Locale.ROOT));
      fo.put("start", f.start().toSql());
      fo.put("end", f.end().toSql());
    }
    return o;
  }

  private static void strings(ArrayNode a, List<String> values) {
    for (String s : values) a.add(s);
  }
}
