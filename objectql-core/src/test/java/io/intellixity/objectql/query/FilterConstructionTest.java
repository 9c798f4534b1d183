package io.intellixity.objectql.query;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class FilterConstructionTest {
  @Test
  void emptyAndIsRejectedAtConstruction() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, Filters::and);
    assertEquals(QueryErrorCode.EMPTY_LOGICAL_GROUP, ex.code());
    assertEquals(QueryErrorCode.Category.STRUCTURAL, ex.category());
  }

  @Test
  void emptyOrIsRejectedAtConstruction() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> new LogicalGroup(Clause.OR, List.of()));
    assertEquals(QueryErrorCode.EMPTY_LOGICAL_GROUP, ex.code());
  }

  @Test
  void singleOperandGroupIsAllowed() {
    LogicalGroup g = Filters.and(Filters.gt("amount", 1000));
    assertEquals(1, g.operands().size());
    assertEquals(Clause.AND, g.clause());
  }

  @Test
  void notWrapsExactlyOneOperand() {
    assertThrows(NullPointerException.class, () -> new NotExpression(null));
    NotExpression n = Filters.not(Filters.or(Filters.eq("a", 1), Filters.eq("b", 2)));
    assertTrue(n.operand() instanceof LogicalGroup);
  }

  @Test
  void groupsAreImmutable() {
    LogicalGroup g = Filters.and(Filters.eq("a", 1), Filters.eq("b", 2));
    assertThrows(UnsupportedOperationException.class, () -> g.operands().add(Filters.eq("c", 3)));
  }

  @Test
  void predicatesCompareByValue() {
    assertEquals(Filters.eq("amount", 1), Filters.eq("amount", new BigDecimal("1.0")));
    assertNotEquals(Filters.eq("amount", 1), Filters.ne("amount", 1));
    assertEquals(Filters.in("status", List.of("a", "b")), Filters.in("status", List.of("a", "b")));
  }

  @Test
  void missingValueIsNull() {
    Predicate p = Filters.isNull("deleted_at");
    assertTrue(p.value().isNull());
    assertEquals(ComparisonOperator.IS_NULL, p.operator());
  }

  @Test
  void liftsPlainJavaValues() {
    assertEquals(QueryValue.NullValue.INSTANCE, QueryValues.of(null));
    assertEquals(new QueryValue.BoolValue(true), QueryValues.of(true));
    assertEquals(new QueryValue.NumberValue(new BigDecimal("2.5")), QueryValues.of(2.5d));
    assertEquals(new QueryValue.StringValue("x"), QueryValues.of("x"));
    assertEquals(QueryValues.sequence(1, 2), QueryValues.of(new int[] {1, 2}));
    assertEquals(new QueryValue.FieldRef("c.id"), QueryValues.of(Map.of("$field", "c.id")));

    QueryValue m = QueryValues.of(Map.of("k", List.of(1)));
    assertTrue(m instanceof QueryValue.MapValue);
    assertEquals(Map.of("k", List.of(BigDecimal.ONE)), m.unwrap());
  }

  @Test
  void rejectsUnsupportedValueTypes() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> QueryValues.of(new Object()));
    assertEquals(QueryErrorCode.MALFORMED_NODE, ex.code());

    ex = assertThrows(QueryValidationException.class, () -> QueryValues.of(Double.NaN));
    assertEquals(QueryErrorCode.MALFORMED_NODE, ex.code());
  }

  @Test
  void operatorsResolveByWireSymbol() {
    assertEquals(ComparisonOperator.GE, ComparisonOperator.fromSymbol(">=").orElseThrow());
    assertEquals(ComparisonOperator.NOT_IN, ComparisonOperator.fromSymbol("NOT_IN").orElseThrow());
    assertEquals(ComparisonOperator.NE, ComparisonOperator.fromSymbol("<>").orElseThrow());
    assertTrue(ComparisonOperator.fromSymbol("like").isEmpty());
    assertEquals(ComparisonOperator.ValueShape.PAIR, ComparisonOperator.BETWEEN.shape());
  }
}
