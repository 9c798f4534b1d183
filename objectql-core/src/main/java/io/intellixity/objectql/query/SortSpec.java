package io.intellixity.objectql.query;

import java.util.Locale;
import java.util.Objects;

public record SortSpec(String field, Direction direction) {
  public SortSpec {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortSpec asc(String field) { return new SortSpec(field, Direction.ASC); }
  public static SortSpec desc(String field) { return new SortSpec(field, Direction.DESC); }

  public enum Direction {
    ASC, DESC;

    public String wireName() { return name().toLowerCase(Locale.ROOT); }
  }
}
