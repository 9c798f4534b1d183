package io.intellixity.objectql.query.join;

import io.intellixity.objectql.query.FilterExpression;

import java.util.Objects;

/**
 * Join to another object or subquery. The {@code on} condition is an ordinary filter tree that must mention the
 * joined target by its qualifier ({@code alias.column}, or {@code object.column} when there is no alias).
 */
public record JoinSpec(JoinType type, JoinTarget target, String alias, FilterExpression on) {
  public JoinSpec {
    type = (type == null) ? JoinType.INNER : type;
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(on, "on");
  }

  /** Name the rest of the query uses to refer to the joined rows. */
  public String qualifier() {
    return alias != null ? alias : target.objectName();
  }
}
