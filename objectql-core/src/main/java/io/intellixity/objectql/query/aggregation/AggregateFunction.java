package io.intellixity.objectql.query.aggregation;

import java.util.Locale;
import java.util.Optional;

public enum AggregateFunction {
  /** COUNT(*) without a field, COUNT(field) with one. */
  COUNT,
  SUM,
  AVG,
  MIN,
  MAX,
  COUNT_DISTINCT,
  ARRAY_AGG,
  STRING_AGG;

  public boolean requiresField() { return this != COUNT; }

  public String wireName() { return name().toLowerCase(Locale.ROOT); }

  public static Optional<AggregateFunction> fromWireName(String s) {
    if (s == null) return Optional.empty();
    try {
      return Optional.of(valueOf(s.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
