package io.intellixity.objectql.query.window;

import java.util.Locale;
import java.util.Optional;

public enum WindowFunction {
  ROW_NUMBER(Kind.RANKING),
  RANK(Kind.RANKING),
  DENSE_RANK(Kind.RANKING),
  PERCENT_RANK(Kind.RANKING),

  LAG(Kind.OFFSET),
  LEAD(Kind.OFFSET),
  FIRST_VALUE(Kind.OFFSET),
  LAST_VALUE(Kind.OFFSET),

  SUM(Kind.AGGREGATE),
  AVG(Kind.AGGREGATE),
  COUNT(Kind.AGGREGATE),
  MIN(Kind.AGGREGATE),
  MAX(Kind.AGGREGATE);

  /** Ranking functions never take a field; offset/value and aggregate functions always do. */
  public enum Kind { RANKING, OFFSET, AGGREGATE }

  private final Kind kind;

  WindowFunction(Kind kind) {
    this.kind = kind;
  }

  public Kind kind() { return kind; }

  public boolean isRanking() { return kind == Kind.RANKING; }

  public String wireName() { return name().toLowerCase(Locale.ROOT); }

  public static Optional<WindowFunction> fromWireName(String s) {
    if (s == null) return Optional.empty();
    try {
      return Optional.of(valueOf(s.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
