package io.intellixity.objectql.query.window;

import io.intellixity.objectql.query.SortSpec;

import java.util.List;

/** OVER clause. A frame is only meaningful together with a non-empty {@code orderBy}. */
public record WindowSpec(List<String> partitionBy, List<SortSpec> orderBy, WindowFrame frame) {
  public WindowSpec {
    partitionBy = List.copyOf(partitionBy == null ? List.of() : partitionBy);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
  }

  public static WindowSpec of(List<String> partitionBy, List<SortSpec> orderBy) {
    return new WindowSpec(partitionBy, orderBy, null);
  }
}
