package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;
import io.intellixity.objectql.query.join.JoinType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class JoinNestingTest {
  @Test
  void eightSubqueryLevelsAreAllowedByDefault() {
    assertDoesNotThrow(() -> new QueryValidator().validate(chain(8)));
  }

  @Test
  void nineSubqueryLevelsAreTooDeep() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> new QueryValidator().validate(chain(9)));
    assertEquals(QueryErrorCode.JOIN_NESTING_TOO_DEEP, ex.code());

    NodePath expected = NodePath.root();
    for (int i = 0; i < 9; i++) expected = expected.key("joins").index(0).key("target");
    assertEquals(expected, ex.path());
  }

  @Test
  void limitComesFromOptions() {
    QueryValidator v = new QueryValidator(ValidatorOptions.load(getClass().getClassLoader(), "objectql-test.properties"));
    assertDoesNotThrow(() -> v.validate(chain(3)));
    assertThrows(QueryValidationException.class, () -> v.validate(chain(4)));
  }

  @Test
  void objectJoinsDoNotAddLevels() {
    QueryEnvelope.Builder b = QueryEnvelope.builder("order");
    for (int i = 0; i < 20; i++) {
      String alias = "t" + i;
      b.join(new JoinSpec(JoinType.LEFT, JoinTarget.object("tag"), alias, Filters.eqField(alias + ".order_id", "order.id")));
    }
    assertDoesNotThrow(() -> new QueryValidator().validate(b.build()));
  }

  @Test
  void errorsInsideSubqueriesCarryTheFullPath() {
    QueryEnvelope inner = QueryEnvelope.builder("payment")
        .where(Filters.and(Filters.eq("status", "settled"), Filters.in("method", java.util.List.of())))
        .build();
    QueryEnvelope q = QueryEnvelope.builder("order")
        .join(new JoinSpec(null, JoinTarget.subquery(inner), "p", Filters.eqField("p.order_id", "order.id")))
        .build();

    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> new QueryValidator().validate(q));
    assertEquals(QueryErrorCode.OPERATOR_ARITY_MISMATCH, ex.code());
    assertEquals("/joins/0/target/where/operands/1/value", ex.path().toString());
  }

  /** Root query whose first join is a subquery, nested {@code levels} deep. */
  private static QueryEnvelope chain(int levels) {
    QueryEnvelope q = QueryEnvelope.builder("node" + levels).build();
    for (int level = levels - 1; level >= 0; level--) {
      String alias = "s" + (level + 1);
      q = QueryEnvelope.builder("node" + level)
          .join(new JoinSpec(JoinType.INNER, JoinTarget.subquery(q), alias, Filters.eqField(alias + ".parent_id", "node" + level + ".id")))
          .build();
    }
    return q;
  }
}
