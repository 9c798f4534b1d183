package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.json.QueryJson;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;
import io.intellixity.objectql.query.join.JoinType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryValidatorTest {
  private final QueryValidator validator = new QueryValidator();

  @Test
  void validQueryIsCanonicalized() {
    CanonicalQuery c = validator.validate(QueryJson.parse("{\"object\": \"order\", \"where\": [\"amount\", \">\", 1000]}"));
    assertTrue(c.selectsAllScalarFields());
    assertEquals(List.of(FieldSelection.wildcard()), c.query().fields());
    assertEquals("{\"object\":\"order\",\"fields\":[\"*\"],\"where\":[\"amount\",\">\",1000]}", c.cacheKey());
  }

  @Test
  void ungroupedColumnInAggregateQuery() {
    String json = """
        {
          "object": "order",
          "fields": ["region", "customer_id"],
          "groupBy": ["region"],
          "aggregations": [{"function": "sum", "field": "amount", "alias": "total"}]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.UNGROUPED_FIELD_IN_AGGREGATE_QUERY, ex.code());
    assertEquals("/fields/1", ex.path().toString());
  }

  @Test
  void aggregationAliasMayBeSelected() {
    String json = """
        {
          "object": "order",
          "fields": ["region", "total"],
          "groupBy": ["region"],
          "aggregations": [{"function": "sum", "field": "amount", "alias": "total"}],
          "having": ["total", ">", 100]
        }
        """;
    assertDoesNotThrow(() -> validator.validate(QueryJson.parse(json)));
  }

  @Test
  void havingNeedsGrouping() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.validate(QueryJson.parse("{\"object\": \"order\", \"having\": [\"amount\", \">\", 1]}")));
    assertEquals(QueryErrorCode.HAVING_WITHOUT_GROUPING, ex.code());
    assertEquals("/having", ex.path().toString());
  }

  @Test
  void distinctCannotBeCombinedWithAggregations() {
    String json = """
        {"object": "order", "distinct": true, "aggregations": [{"function": "count", "alias": "n"}]}
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DISTINCT_WITH_AGGREGATION, ex.code());
    assertEquals("/distinct", ex.path().toString());
  }

  @Test
  void perAggregationDistinctIsFine() {
    String json = """
        {"object": "order", "aggregations": [{"function": "count", "field": "customer_id", "alias": "n", "distinct": true}]}
        """;
    CanonicalQuery c = validator.validate(QueryJson.parse(json));
    assertNull(c.query().fields());
    assertTrue(c.query().aggregations().get(0).distinct());
  }

  @Test
  void aggregateFunctionsOtherThanCountNeedAField() {
    String json = """
        {"object": "order", "aggregations": [{"function": "sum", "alias": "total"}]}
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.MISSING_AGGREGATION_FIELD, ex.code());
    assertEquals("/aggregations/0/field", ex.path().toString());
  }

  @Test
  void aggregationAliasesAreUnique() {
    String json = """
        {
          "object": "order",
          "aggregations": [
            {"function": "count", "alias": "n"},
            {"function": "max", "field": "amount", "alias": "n"}
          ]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DUPLICATE_AGGREGATION_ALIAS, ex.code());
    assertEquals("/aggregations/1/alias", ex.path().toString());
  }

  @Test
  void rankingFunctionRejectsAField() {
    String json = """
        {
          "object": "sale",
          "windowFunctions": [{"function": "row_number", "field": "amount", "alias": "rn", "over": {"orderBy": ["sold_at"]}}]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.RANKING_FUNCTION_WITH_FIELD, ex.code());
    assertEquals("/windowFunctions/0/field", ex.path().toString());
  }

  @Test
  void offsetFunctionNeedsAField() {
    String json = """
        {"object": "sale", "windowFunctions": [{"function": "lag", "alias": "prev", "over": {"orderBy": ["sold_at"]}}]}
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.OFFSET_FUNCTION_WITHOUT_FIELD, ex.code());
  }

  @Test
  void frameNeedsOrderBy() {
    String json = """
        {
          "object": "sale",
          "windowFunctions": [{
            "function": "sum", "field": "amount", "alias": "running",
            "over": {"partitionBy": ["region"], "frame": {"type": "rows", "start": "UNBOUNDED PRECEDING"}}
          }]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.FRAME_WITHOUT_ORDER, ex.code());
    assertEquals("/windowFunctions/0/over/frame", ex.path().toString());
  }

  @Test
  void frameMustNotStartAfterItEnds() {
    String json = """
        {
          "object": "sale",
          "windowFunctions": [{
            "function": "avg", "field": "amount", "alias": "avg",
            "over": {"orderBy": ["sold_at"], "frame": {"type": "range", "start": "1 FOLLOWING", "end": "1 PRECEDING"}}
          }]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.INVALID_WINDOW_FRAME, ex.code());
  }

  @Test
  void windowAliasMustNotClashWithAggregationAlias() {
    String json = """
        {
          "object": "sale",
          "aggregations": [{"function": "count", "alias": "n"}],
          "windowFunctions": [{"function": "rank", "alias": "n", "over": {"orderBy": ["sold_at"]}}]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DUPLICATE_WINDOW_ALIAS, ex.code());
    assertEquals("/windowFunctions/0/alias", ex.path().toString());
  }

  @Test
  void negativeLimitIsRejected() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.validate(QueryEnvelope.builder("order").limit(-1).build()));
    assertEquals(QueryErrorCode.NEGATIVE_LIMIT, ex.code());
    assertEquals("/limit", ex.path().toString());
  }

  @Test
  void negativeOffsetIsRejected() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.validate(QueryEnvelope.builder("order").offset(-5).build()));
    assertEquals(QueryErrorCode.NEGATIVE_OFFSET, ex.code());
  }

  @Test
  void zeroLimitIsValid() {
    CanonicalQuery c = validator.validate(QueryEnvelope.builder("order").limit(0).build());
    assertEquals(0, c.query().pagination().limit());
  }

  @Test
  void duplicateOutputColumnsAreRejected() {
    String json = """
        {"object": "order", "fields": ["name", {"field": "owner", "alias": "name"}]}
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DUPLICATE_SELECTION_ALIAS, ex.code());
    assertEquals("/fields/1", ex.path().toString());
  }

  @Test
  void duplicateJoinAliasIsRejected() {
    String json = """
        {
          "object": "order",
          "joins": [
            {"object": "customer", "alias": "c", "on": ["order.customer_id", "=", {"$field": "c.id"}]},
            {"object": "carrier", "alias": "c", "on": ["order.carrier_id", "=", {"$field": "c.id"}]}
          ]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DUPLICATE_JOIN_ALIAS, ex.code());
    assertEquals("/joins/1/alias", ex.path().toString());
  }

  @Test
  void joinConditionMustReferenceTheTarget() {
    String json = """
        {"object": "order", "joins": [{"object": "customer", "alias": "c", "on": ["order.customer_id", "=", 5]}]}
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.JOIN_CONDITION_UNBOUND, ex.code());
    assertEquals("/joins/0/on", ex.path().toString());
  }

  @Test
  void joinConditionMayReferenceTheTargetAsAString() {
    String json = """
        {"object": "order", "joins": [{"object": "customer", "alias": "c", "on": ["order.customer_id", "=", "c.id"]}]}
        """;
    assertDoesNotThrow(() -> validator.validate(QueryJson.parse(json)));
  }

  @Test
  void unaliasedJoinIsQualifiedByObjectName() {
    String json = """
        {"object": "order", "joins": [{"object": "customer", "on": ["customer.id", "=", {"$field": "order.customer_id"}]}]}
        """;
    assertDoesNotThrow(() -> validator.validate(QueryJson.parse(json)));
  }

  @Test
  void firstErrorWins() {
    String json = """
        {"object": "order", "limit": -1, "where": ["amount", "between", [1]]}
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.NEGATIVE_LIMIT, ex.code());
  }

  @Test
  void syntacticVariantsShareOneCanonicalForm() {
    String a = """
        {
          "object": "order",
          "fields": ["region", "total", "region"],
          "where": ["and", ["a", "=", 1], ["and", ["b", "=", 2]]],
          "groupBy": ["region", "country"],
          "aggregations": [{"function": "sum", "field": "amount", "alias": "total"}],
          "limit": 5,
          "offset": 0
        }
        """;
    String b = """
        {
          "object": "order",
          "fields": ["region", "total"],
          "where": ["and", ["a", "=", 1], ["b", "=", 2]],
          "groupBy": ["country", "region"],
          "aggregations": [{"function": "sum", "field": "amount", "alias": "total"}],
          "limit": 5
        }
        """;

    CanonicalQuery ca = validator.validate(QueryJson.parse(a));
    CanonicalQuery cb = validator.validate(QueryJson.parse(b));
    assertEquals(ca, cb);
    assertEquals(ca.cacheKey(), cb.cacheKey());
    assertEquals(List.of("country", "region"), ca.query().groupBy());
    assertEquals(OffsetPagination.limit(5), ca.query().pagination());
  }

  @Test
  void omittedFieldsInGroupedQueryBecomeTheGroupedColumns() {
    String json = """
        {"object": "order", "groupBy": ["region", "country"], "aggregations": [{"function": "count", "alias": "n"}]}
        """;
    CanonicalQuery c = validator.validate(QueryJson.parse(json));
    assertEquals(List.of(FieldSelection.scalar("country"), FieldSelection.scalar("region")), c.query().fields());
    assertFalse(c.selectsAllScalarFields());
  }

  @Test
  void validationIsIdempotent() {
    String json = """
        {
          "object": "order",
          "where": ["or", ["status", "=", "paid"], ["or", ["status", "=", "shipped"]]],
          "joins": [{
            "subquery": {"object": "payment", "where": ["and", ["settled", "=", true]], "offset": 0},
            "alias": "p",
            "on": ["p.order_id", "=", {"$field": "order.id"}]
          }],
          "orderBy": [{"field": "created_at", "order": "desc"}],
          "cursor": {"created_at": "2024-01-01"},
          "limit": 50
        }
        """;
    CanonicalQuery once = validator.validate(QueryJson.parse(json));
    CanonicalQuery twice = validator.validate(once.query());
    assertEquals(once, twice);
    assertEquals(once.cacheKey(), twice.cacheKey());

    CanonicalQuery reparsed = validator.validate(QueryJson.parse(once.cacheKey()));
    assertEquals(once, reparsed);
  }

  @Test
  void convenienceEntryPointsCheckSingleParts() {
    assertThrows(QueryValidationException.class,
        () -> validator.validateSelection(List.of(FieldSelection.scalar(""))));
    assertDoesNotThrow(() -> validator.validateSelection(List.of(FieldSelection.scalar("a"), FieldSelection.scalar("a"))));

    QueryEnvelope agg = QueryEnvelope.builder("order")
        .select("customer_id")
        .aggregation(io.intellixity.objectql.query.aggregation.AggregationSpec.count("n"))
        .build();
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.checkAggregationConsistency(agg));
    assertEquals(QueryErrorCode.UNGROUPED_FIELD_IN_AGGREGATE_QUERY, ex.code());
  }

  @Test
  void longFoldedWhereValidatesToAFlatGroup() {
    QueryEnvelope q = QueryEnvelope.builder("order").where(FilterShapesTest.foldAnd(10_000)).build();
    CanonicalQuery c = validator.validate(q);
    LogicalGroup where = assertInstanceOf(LogicalGroup.class, c.query().where());
    assertEquals(10_000, where.operands().size());
    assertTrue(c.cacheKey().startsWith("{\"object\":\"order\",\"fields\":[\"*\"],\"where\":[\"and\",[\"f0\",\"=\",0],"));
  }

  @Test
  void longFoldedJoinConditionIsBound() {
    FilterExpression on = Filters.and(FilterShapesTest.foldAnd(10_000), Filters.eqField("order.customer_id", "c.id"));
    QueryEnvelope q = QueryEnvelope.builder("order")
        .join(new JoinSpec(JoinType.INNER, JoinTarget.object("customer"), "c", on))
        .build();
    assertDoesNotThrow(() -> validator.validate(q));
  }

  @Test
  void cursorKeyOrderDoesNotChangeTheCacheKey() {
    Map<String, Object> ab = new LinkedHashMap<>();
    ab.put("a", 1);
    ab.put("b", 2);
    Map<String, Object> ba = new LinkedHashMap<>();
    ba.put("b", 2);
    ba.put("a", 1);

    CanonicalQuery c1 = validator.validate(QueryEnvelope.builder("order").cursor(ab).build());
    CanonicalQuery c2 = validator.validate(QueryEnvelope.builder("order").cursor(ba).build());
    assertEquals(c1, c2);
    assertEquals(c1.cacheKey(), c2.cacheKey());
    assertEquals("{\"object\":\"order\",\"fields\":[\"*\"],\"cursor\":{\"a\":1,\"b\":2}}", c2.cacheKey());
  }

  @Test
  void unaliasedJoinsToTheSameObjectCollide() {
    String json = """
        {
          "object": "order",
          "joins": [
            {"object": "customer", "on": ["customer.id", "=", {"$field": "order.customer_id"}]},
            {"object": "customer", "on": ["customer.id", "=", {"$field": "order.referrer_id"}]}
          ]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DUPLICATE_JOIN_ALIAS, ex.code());
    assertEquals("/joins/1/target", ex.path().toString());
  }

  @Test
  void aliasMatchingAnUnaliasedSiblingCollides() {
    String json = """
        {
          "object": "order",
          "joins": [
            {"object": "customer", "on": ["customer.id", "=", {"$field": "order.customer_id"}]},
            {"object": "account", "alias": "customer", "on": ["customer.id", "=", {"$field": "order.account_id"}]}
          ]
        }
        """;
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.validate(QueryJson.parse(json)));
    assertEquals(QueryErrorCode.DUPLICATE_JOIN_ALIAS, ex.code());
    assertEquals("/joins/1/alias", ex.path().toString());
  }
}
