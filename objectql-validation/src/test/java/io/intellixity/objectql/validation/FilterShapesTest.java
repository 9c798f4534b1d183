package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FilterShapesTest {
  private final QueryValidator validator = new QueryValidator();

  @Test
  void betweenNeedsExactlyTwoBounds() {
    for (List<Integer> bounds : List.of(List.<Integer>of(), List.of(1), List.of(1, 2, 3))) {
      QueryValidationException ex = assertThrows(QueryValidationException.class,
          () -> validator.evaluateShape(Predicate.of("amount", ComparisonOperator.BETWEEN, bounds)));
      assertEquals(QueryErrorCode.OPERATOR_ARITY_MISMATCH, ex.code());
      assertEquals("/value", ex.path().toString());
    }
    assertDoesNotThrow(() -> validator.evaluateShape(Filters.between("amount", 1, 2)));
  }

  @Test
  void betweenBoundsMustBeScalars() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.evaluateShape(Filters.between("amount", null, 2)));
    assertEquals(QueryErrorCode.OPERATOR_ARITY_MISMATCH, ex.code());
  }

  @Test
  void setOperatorsNeedANonEmptyList() {
    assertThrows(QueryValidationException.class, () -> validator.evaluateShape(Filters.in("status", List.of())));
    assertThrows(QueryValidationException.class, () -> validator.evaluateShape(Predicate.of("status", ComparisonOperator.NOT_IN, "a")));
    assertDoesNotThrow(() -> validator.evaluateShape(Filters.notIn("status", List.of("a"))));
  }

  @Test
  void nullChecksTakeNoValue() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.evaluateShape(Predicate.of("deleted_at", ComparisonOperator.IS_NULL, "x")));
    assertEquals(QueryErrorCode.OPERATOR_ARITY_MISMATCH, ex.code());
    assertDoesNotThrow(() -> validator.evaluateShape(Filters.isNotNull("deleted_at")));
  }

  @Test
  void textOperatorsTakeStrings() {
    assertThrows(QueryValidationException.class, () -> validator.evaluateShape(Predicate.of("name", ComparisonOperator.CONTAINS, 5)));
    assertDoesNotThrow(() -> validator.evaluateShape(Filters.startsWith("name", "Jo")));
  }

  @Test
  void orderingOperatorsRejectBooleansAndLists() {
    assertThrows(QueryValidationException.class, () -> validator.evaluateShape(Filters.gt("active", true)));
    assertThrows(QueryValidationException.class, () -> validator.evaluateShape(Filters.le("amount", List.of(1))));
    assertDoesNotThrow(() -> validator.evaluateShape(Predicate.of("amount", ComparisonOperator.LT, QueryValues.field("limit"))));
  }

  @Test
  void equalityAcceptsNullButNotLists() {
    assertDoesNotThrow(() -> validator.evaluateShape(Filters.eq("parent_id", null)));
    assertThrows(QueryValidationException.class, () -> validator.evaluateShape(Filters.eq("tags", List.of("a"))));
  }

  @Test
  void blankFieldIsMalformed() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> validator.evaluateShape(Filters.and(Filters.eq("a", 1), Filters.eq(" ", 1))));
    assertEquals(QueryErrorCode.MALFORMED_NODE, ex.code());
    assertEquals("/operands/1/field", ex.path().toString());
  }

  @Test
  void nestingGuardCountsNotLevels() {
    QueryValidator shallow = new QueryValidator(ValidatorOptions.defaults().withMaxExpressionDepth(3));
    FilterExpression deep = Filters.not(Filters.not(Filters.not(Filters.not(Filters.eq("a", 1)))));

    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> shallow.evaluateShape(deep));
    assertEquals(QueryErrorCode.EXPRESSION_NESTING_TOO_DEEP, ex.code());
    assertEquals("/operand/operand/operand", ex.path().toString());
  }

  @Test
  void sameClauseNestingDoesNotCountAsDepth() {
    QueryValidator flat = new QueryValidator(ValidatorOptions.defaults().withMaxExpressionDepth(1));
    FilterExpression redundant = Filters.and(Filters.and(Filters.and(Filters.eq("a", 1), Filters.eq("b", 2)), Filters.eq("c", 3)));
    assertDoesNotThrow(() -> flat.evaluateShape(redundant));

    FilterExpression mixed = Filters.and(Filters.or(Filters.eq("a", 1), Filters.eq("b", 2)), Filters.eq("c", 3));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> flat.evaluateShape(mixed));
    assertEquals(QueryErrorCode.EXPRESSION_NESTING_TOO_DEEP, ex.code());
    assertEquals("/operands/0", ex.path().toString());
  }

  @Test
  void normalizingNeverChangesValidity() {
    QueryValidator flat = new QueryValidator(ValidatorOptions.defaults().withMaxExpressionDepth(2));
    List<FilterExpression> samples = List.of(
        Filters.and(Filters.or(Filters.and(Filters.eq("a", 1), Filters.eq("b", 2)), Filters.eq("c", 3)), Filters.eq("d", 4)),
        Filters.or(Filters.or(Filters.eq("a", 1)), Filters.and(Filters.eq("b", 2))),
        Filters.not(Filters.and(Filters.or(Filters.eq("a", 1), Filters.eq("b", 2)), Filters.eq("c", 3))),
        Filters.and(Filters.between("x", 1, 2), Filters.and(Predicate.of("y", ComparisonOperator.BETWEEN, List.of(1)))));

    for (FilterExpression e : samples) {
      boolean before = passes(flat, e);
      boolean after = passes(flat, FilterNormalizer.normalize(e));
      assertEquals(before, after, e.toString());
    }
  }

  private static boolean passes(QueryValidator v, FilterExpression e) {
    try {
      v.evaluateShape(e);
      return true;
    } catch (QueryValidationException ex) {
      return false;
    }
  }

  @Test
  void longFoldedAndChainIsOneLevelDeep() {
    FilterExpression chain = foldAnd(10_000);
    QueryValidator flat = new QueryValidator(ValidatorOptions.defaults().withMaxExpressionDepth(1));
    assertDoesNotThrow(() -> flat.evaluateShape(chain));
    assertDoesNotThrow(() -> validator.evaluateShape(Filters.not(Filters.or(chain))));
  }

  @Test
  void errorInsideFlattenedGroupsKeepsTheFullPath() {
    FilterExpression e = Filters.and(Filters.and(Filters.eq("a", 1), Filters.in("b", List.of())), Filters.eq("c", 3));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.evaluateShape(e));
    assertEquals(QueryErrorCode.OPERATOR_ARITY_MISMATCH, ex.code());
    assertEquals("/operands/0/operands/1/value", ex.path().toString());
  }

  @Test
  void errorAtTheBottomOfALongChainIsReported() {
    FilterExpression chain = Filters.and(foldAnd(5_000), Filters.isNull("x"), Filters.gt("y", true));
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> validator.evaluateShape(chain));
    assertEquals(QueryErrorCode.OPERATOR_ARITY_MISMATCH, ex.code());
    assertEquals("/operands/2/value", ex.path().toString());
  }

  static FilterExpression foldAnd(int n) {
    FilterExpression acc = Filters.eq("f0", 0);
    for (int i = 1; i < n; i++) acc = Filters.and(acc, Filters.eq("f" + i, i));
    return acc;
  }
}
