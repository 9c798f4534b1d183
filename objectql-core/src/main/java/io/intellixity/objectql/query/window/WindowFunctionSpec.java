package io.intellixity.objectql.query.window;

import java.util.Objects;

/** {@code function(field) OVER (...) AS alias}. Field presence rules are checked by the validator. */
public record WindowFunctionSpec(WindowFunction function, String field, String alias, WindowSpec over) {
  public WindowFunctionSpec {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(alias, "alias");
    over = (over == null) ? new WindowSpec(null, null, null) : over;
  }
}
