package io.intellixity.objectql.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.objectql.query.aggregation.AggregationSpec;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.json.QueryEnvelopeJsonDeserializer;
import io.intellixity.objectql.query.json.QueryEnvelopeJsonSerializer;
import io.intellixity.objectql.query.window.WindowFunctionSpec;

import java.util.*;

/**
 * Root of the query IR: a target object plus selection, filters, joins, grouping, windows, sorting and paging.
 * <p>
 * Immutable. Build with {@link #builder(String)}; derive modified copies with {@link #toBuilder()}.
 */
@JsonSerialize(using = QueryEnvelopeJsonSerializer.class)
@JsonDeserialize(using = QueryEnvelopeJsonDeserializer.class)
public final class QueryEnvelope {
  private final String object;
  private final List<FieldSelection> fields;
  private final FilterExpression where;
  private final List<JoinSpec> joins;
  private final List<String> groupBy;
  private final FilterExpression having;
  private final List<SortSpec> orderBy;
  private final List<WindowFunctionSpec> windowFunctions;
  private final List<AggregationSpec> aggregations;
  private final boolean distinct;
  private final Pagination pagination;

  private QueryEnvelope(Builder b) {
    this.object = b.object;
    this.fields = (b.fields == null) ? null : List.copyOf(b.fields);
    this.where = b.where;
    this.joins = List.copyOf(b.joins);
    this.groupBy = List.copyOf(b.groupBy);
    this.having = b.having;
    this.orderBy = List.copyOf(b.orderBy);
    this.windowFunctions = List.copyOf(b.windowFunctions);
    this.aggregations = List.copyOf(b.aggregations);
    this.distinct = b.distinct;
    this.pagination = b.pagination();
  }

  public static Builder builder(String object) { return new Builder(object); }

  public Builder toBuilder() {
    Builder b = new Builder(object)
        .fields(fields)
        .where(where)
        .joins(joins)
        .groupBy(groupBy)
        .having(having)
        .orderBy(orderBy)
        .windowFunctions(windowFunctions)
        .aggregations(aggregations)
        .distinct(distinct);
    return b.pagination(pagination);
  }

  public String object() { return object; }
  /** Select list, or null when omitted ("all scalar fields of {@link #object()}"). */
  public List<FieldSelection> fields() { return fields; }
  public FilterExpression where() { return where; }
  public List<JoinSpec> joins() { return joins; }
  public List<String> groupBy() { return groupBy; }
  public FilterExpression having() { return having; }
  public List<SortSpec> orderBy() { return orderBy; }
  public List<WindowFunctionSpec> windowFunctions() { return windowFunctions; }
  public List<AggregationSpec> aggregations() { return aggregations; }
  public boolean distinct() { return distinct; }
  /** Null when the query is unbounded. */
  public Pagination pagination() { return pagination; }

  public boolean isAggregate() { return !aggregations.isEmpty() || !groupBy.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryEnvelope q)) return false;
    return distinct == q.distinct
        && object.equals(q.object)
        && Objects.equals(fields, q.fields)
        && Objects.equals(where, q.where)
        && joins.equals(q.joins)
        && groupBy.equals(q.groupBy)
        && Objects.equals(having, q.having)
        && orderBy.equals(q.orderBy)
        && windowFunctions.equals(q.windowFunctions)
        && aggregations.equals(q.aggregations)
        && Objects.equals(pagination, q.pagination);
  }

  @Override
  public int hashCode() {
    return Objects.hash(object, fields, where, joins, groupBy, having, orderBy, windowFunctions, aggregations,
        distinct, pagination);
  }

  @Override
  public String toString() {
    return "QueryEnvelope{object=" + object + ", fields=" + fields + ", where=" + where + ", joins=" + joins.size()
        + ", groupBy=" + groupBy + ", aggregations=" + aggregations.size()
        + ", windowFunctions=" + windowFunctions.size() + ", pagination=" + pagination + "}";
  }

  public static final class Builder {
    private final String object;
    private List<FieldSelection> fields;
    private FilterExpression where;
    private List<JoinSpec> joins = new ArrayList<>();
    private List<String> groupBy = new ArrayList<>();
    private FilterExpression having;
    private List<SortSpec> orderBy = new ArrayList<>();
    private List<WindowFunctionSpec> windowFunctions = new ArrayList<>();
    private List<AggregationSpec> aggregations = new ArrayList<>();
    private boolean distinct;

    private Integer limit;
    private Integer offset;
    private Map<String, QueryValue> cursor;

    private Builder(String object) {
      this.object = Objects.requireNonNull(object, "object");
    }

    /** Null (or empty) means "all scalar fields". */
    public Builder fields(List<? extends FieldSelection> fields) {
      this.fields = (fields == null || fields.isEmpty()) ? null : new ArrayList<>(fields);
      return this;
    }

    public Builder fields(FieldSelection... fields) { return fields(List.of(fields)); }

    /** Shorthand for a list of scalar columns. */
    public Builder select(String... names) {
      List<FieldSelection> out = new ArrayList<>(names.length);
      for (String n : names) out.add(FieldSelection.scalar(n));
      return fields(out);
    }

    public Builder where(FilterExpression where) { this.where = where; return this; }
    public Builder joins(List<JoinSpec> joins) { this.joins = new ArrayList<>(joins == null ? List.of() : joins); return this; }
    public Builder join(JoinSpec join) { this.joins.add(Objects.requireNonNull(join, "join")); return this; }
    public Builder groupBy(List<String> groupBy) { this.groupBy = new ArrayList<>(groupBy == null ? List.of() : groupBy); return this; }
    public Builder groupBy(String... groupBy) { return groupBy(List.of(groupBy)); }
    public Builder having(FilterExpression having) { this.having = having; return this; }
    public Builder orderBy(List<SortSpec> orderBy) { this.orderBy = new ArrayList<>(orderBy == null ? List.of() : orderBy); return this; }
    public Builder orderBy(SortSpec... orderBy) { return orderBy(List.of(orderBy)); }
    public Builder windowFunctions(List<WindowFunctionSpec> fns) { this.windowFunctions = new ArrayList<>(fns == null ? List.of() : fns); return this; }
    public Builder windowFunction(WindowFunctionSpec fn) { this.windowFunctions.add(Objects.requireNonNull(fn, "fn")); return this; }
    public Builder aggregations(List<AggregationSpec> aggs) { this.aggregations = new ArrayList<>(aggs == null ? List.of() : aggs); return this; }
    public Builder aggregation(AggregationSpec agg) { this.aggregations.add(Objects.requireNonNull(agg, "agg")); return this; }
    public Builder distinct(boolean distinct) { this.distinct = distinct; return this; }

    public Builder limit(Integer limit) { this.limit = limit; return this; }
    public Builder offset(Integer offset) { this.offset = offset; return this; }
    public Builder cursor(Map<String, ?> cursor) { this.cursor = (cursor == null) ? null : QueryValues.ofMap(cursor); return this; }

    /**
     * Applies a pagination value on top of what is already set. Setting a cursor mode over an offset (or the
     * reverse) makes {@link #build()} fail rather than silently replace the earlier mode.
     */
    public Builder pagination(Pagination p) {
      if (p == null) return this;
      if (p instanceof OffsetPagination op) {
        this.limit = op.limit();
        this.offset = op.offset();
      } else if (p instanceof CursorPagination cp) {
        this.cursor = cp.cursor();
        this.limit = cp.limit();
      } else {
        throw new IllegalArgumentException("Unsupported pagination: " + p.getClass().getName());
      }
      return this;
    }

    /** @throws QueryValidationException {@link QueryErrorCode#CONFLICTING_PAGINATION_MODES} */
    public QueryEnvelope build() {
      return new QueryEnvelope(this);
    }

    private Pagination pagination() {
      if (cursor != null) {
        if (offset != null) {
          throw new QueryValidationException(QueryErrorCode.CONFLICTING_PAGINATION_MODES, NodePath.of("cursor"),
              "cursor pagination cannot be combined with offset pagination");
        }
        return new CursorPagination(cursor, limit);
      }
      if (limit != null || offset != null) return new OffsetPagination(limit, offset);
      return null;
    }
  }
}
