package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.aggregation.AggregateFunction;
import io.intellixity.objectql.query.aggregation.AggregationSpec;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;
import io.intellixity.objectql.query.join.JoinType;
import io.intellixity.objectql.query.window.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Maps the structured wire form (a Jackson tree) onto an unvalidated {@link QueryEnvelope}.
 * <p>
 * Only shape problems that make a node unrepresentable fail here ({@link QueryErrorCode#MALFORMED_NODE}, empty
 * groups, conflicting pagination). Everything else is left to the validator. Unknown keys are ignored.
 */
public final class QueryEnvelopeReader {
  private static final Logger log = LoggerFactory.getLogger(QueryEnvelopeReader.class);

  private static final Set<String> KNOWN_KEYS = Set.of(
      "object", "fields", "where", "joins", "groupBy", "having", "orderBy", "windowFunctions", "aggregations",
      "distinct", "limit", "offset", "cursor");

  public QueryEnvelope read(JsonNode root) {
    return readEnvelope(root, NodePath.root());
  }

  private QueryEnvelope readEnvelope(JsonNode n, NodePath path) {
    ObjectNode raw = JsonValues.object(n, path);
    ObjectNode q = LegacyQueryTranslator.translate(raw, path);
    logUnknownKeys(q, path);

    QueryEnvelope.Builder b = QueryEnvelope.builder(JsonValues.text(q.get("object"), path.key("object"), true));

    JsonNode fields = q.get("fields");
    if (!JsonValues.isAbsent(fields)) b.fields(readSelections(JsonValues.array(fields, path.key("fields")), path.key("fields")));

    b.where(FilterReader.read(q.get("where"), path.key("where")));

    JsonNode joins = q.get("joins");
    if (!JsonValues.isAbsent(joins)) {
      ArrayNode arr = JsonValues.array(joins, path.key("joins"));
      List<JoinSpec> out = new ArrayList<>(arr.size());
      for (int i = 0; i < arr.size(); i++) out.add(readJoin(arr.get(i), path.key("joins").index(i)));
      b.joins(out);
    }

    b.groupBy(JsonValues.strings(q.get("groupBy"), path.key("groupBy")));
    b.having(FilterReader.read(q.get("having"), path.key("having")));
    b.orderBy(readSorts(q.get("orderBy"), path.key("orderBy")));

    JsonNode windows = q.get("windowFunctions");
    if (!JsonValues.isAbsent(windows)) {
      ArrayNode arr = JsonValues.array(windows, path.key("windowFunctions"));
      List<WindowFunctionSpec> out = new ArrayList<>(arr.size());
      for (int i = 0; i < arr.size(); i++) out.add(readWindowFunction(arr.get(i), path.key("windowFunctions").index(i)));
      b.windowFunctions(out);
    }

    JsonNode aggs = q.get("aggregations");
    if (!JsonValues.isAbsent(aggs)) {
      ArrayNode arr = JsonValues.array(aggs, path.key("aggregations"));
      List<AggregationSpec> out = new ArrayList<>(arr.size());
      for (int i = 0; i < arr.size(); i++) out.add(readAggregation(arr.get(i), path.key("aggregations").index(i)));
      b.aggregations(out);
    }

    b.distinct(JsonValues.bool(q.get("distinct"), path.key("distinct")));
    b.limit(JsonValues.integer(q.get("limit"), path.key("limit")));
    b.offset(JsonValues.integer(q.get("offset"), path.key("offset")));

    JsonNode cursor = q.get("cursor");
    if (!JsonValues.isAbsent(cursor)) {
      QueryValue cv = JsonValues.toValue(JsonValues.object(cursor, path.key("cursor")), path.key("cursor"));
      if (cv instanceof QueryValue.MapValue m) {
        b.cursor(m.entries());
      } else {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("cursor"), "cursor must be a key/value map");
      }
    }

    try {
      return b.build();
    } catch (QueryValidationException e) {
      throw e.under(path);
    }
  }

  private List<FieldSelection> readSelections(ArrayNode arr, NodePath path) {
    List<FieldSelection> out = new ArrayList<>(arr.size());
    for (int i = 0; i < arr.size(); i++) out.add(readSelection(arr.get(i), path.index(i)));
    return out;
  }

  private FieldSelection readSelection(JsonNode n, NodePath path) {
    if (n.isTextual()) return FieldSelection.scalar(n.textValue());
    ObjectNode o = JsonValues.object(n, path);
    String name = JsonValues.text(o.get("field"), path.key("field"), true);
    String alias = JsonValues.text(o.get("alias"), path.key("alias"), false);
    JsonNode sub = o.get("fields");
    List<FieldSelection> subs = JsonValues.isAbsent(sub)
        ? List.of()
        : readSelections(JsonValues.array(sub, path.key("fields")), path.key("fields"));
    return FieldSelection.relation(name, alias, subs);
  }

  private JoinSpec readJoin(JsonNode n, NodePath path) {
    ObjectNode o = JsonValues.object(n, path);
    String typeText = JsonValues.text(o.get("type"), path.key("type"), false);
    JoinType type = (typeText == null) ? JoinType.INNER : JoinType.fromWireName(typeText).orElseThrow(() ->
        new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("type"), "unknown join type '" + typeText + "'"));

    JoinTarget target;
    JsonNode sub = o.get("subquery");
    if (!JsonValues.isAbsent(sub)) {
      QueryEnvelope subquery = readEnvelope(sub, path.key("target"));
      String object = JsonValues.text(o.get("object"), path.key("object"), false);
      if (object != null && !object.equals(subquery.object())) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("object"),
            "join object '" + object + "' does not match subquery object '" + subquery.object() + "'");
      }
      target = JoinTarget.subquery(subquery);
    } else {
      target = JoinTarget.object(JsonValues.text(o.get("object"), path.key("object"), true));
    }
    String alias = JsonValues.text(o.get("alias"), path.key("alias"), false);
    FilterExpression on = FilterReader.readRequired(LegacyQueryTranslator.filter(o.get("on"), path.key("on")), path.key("on"));
    return new JoinSpec(type, target, alias, on);
  }

  private List<SortSpec> readSorts(JsonNode n, NodePath path) {
    if (JsonValues.isAbsent(n)) return List.of();
    ArrayNode arr = JsonValues.array(n, path);
    List<SortSpec> out = new ArrayList<>(arr.size());
    for (int i = 0; i < arr.size(); i++) out.add(readSort(arr.get(i), path.index(i)));
    return out;
  }

  private SortSpec readSort(JsonNode n, NodePath path) {
    if (n.isTextual()) return SortSpec.asc(n.textValue());
    ObjectNode o = JsonValues.object(n, path);
    String field = JsonValues.text(o.get("field"), path.key("field"), true);
    String order = JsonValues.text(o.get("order"), path.key("order"), false);
    if (order == null) return SortSpec.asc(field);
    switch (order.trim().toLowerCase(Locale.ROOT)) {
      case "asc": return SortSpec.asc(field);
      case "desc": return SortSpec.desc(field);
      default:
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("order"),
            "order must be asc or desc, got '" + order + "'");
    }
  }

  private AggregationSpec readAggregation(JsonNode n, NodePath path) {
    ObjectNode o = JsonValues.object(n, path);
    String fn = JsonValues.text(o.get("function"), path.key("function"), true);
    AggregateFunction function = AggregateFunction.fromWireName(fn).orElseThrow(() ->
        new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("function"), "unknown aggregate function '" + fn + "'"));
    return new AggregationSpec(
        function,
        JsonValues.text(o.get("field"), path.key("field"), false),
        JsonValues.text(o.get("alias"), path.key("alias"), true),
        JsonValues.bool(o.get("distinct"), path.key("distinct")));
  }

  private WindowFunctionSpec readWindowFunction(JsonNode n, NodePath path) {
    ObjectNode o = JsonValues.object(n, path);
    String fn = JsonValues.text(o.get("function"), path.key("function"), true);
    WindowFunction function = WindowFunction.fromWireName(fn).orElseThrow(() ->
        new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("function"), "unknown window function '" + fn + "'"));
    JsonNode over = o.get("over");
    WindowSpec window = JsonValues.isAbsent(over) ? null : readWindowSpec(JsonValues.object(over, path.key("over")), path.key("over"));
    return new WindowFunctionSpec(
        function,
        JsonValues.text(o.get("field"), path.key("field"), false),
        JsonValues.text(o.get("alias"), path.key("alias"), true),
        window);
  }

  private WindowSpec readWindowSpec(ObjectNode o, NodePath path) {
    List<String> partitionBy = JsonValues.strings(o.get("partitionBy"), path.key("partitionBy"));
    List<SortSpec> orderBy = readSorts(o.get("orderBy"), path.key("orderBy"));
    JsonNode frame = o.get("frame");
    WindowFrame wf = JsonValues.isAbsent(frame) ? null : readFrame(JsonValues.object(frame, path.key("frame")), path.key("frame"));
    return new WindowSpec(partitionBy, orderBy, wf);
  }

  private WindowFrame readFrame(ObjectNode o, NodePath path) {
    String type = JsonValues.text(o.get("type"), path.key("type"), false);
    FrameMode mode;
    if (type == null || type.equalsIgnoreCase("rows")) {
      mode = FrameMode.ROWS;
    } else if (type.equalsIgnoreCase("range")) {
      mode = FrameMode.RANGE;
    } else {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("type"), "frame type must be rows or range");
    }
    FrameBound start = readBound(o.get("start"), path.key("start"), FrameBound.UNBOUNDED_PRECEDING);
    FrameBound end = readBound(o.get("end"), path.key("end"), FrameBound.CURRENT_ROW);
    return new WindowFrame(mode, start, end);
  }

  private FrameBound readBound(JsonNode n, NodePath path, FrameBound def) {
    String text = JsonValues.text(n, path, false);
    if (text == null) return def;
    return FrameBound.parse(text).orElseThrow(() ->
        new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "not a frame bound: '" + text + "'"));
  }

  private static void logUnknownKeys(ObjectNode q, NodePath path) {
    if (!log.isDebugEnabled()) return;
    Iterator<String> it = q.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      if (!KNOWN_KEYS.contains(k)) log.debug("objectql.json ignored_key key={} path={}", k, path);
    }
  }
}
