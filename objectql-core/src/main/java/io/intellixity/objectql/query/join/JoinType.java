package io.intellixity.objectql.query.join;

import java.util.Locale;
import java.util.Optional;

public enum JoinType {
  INNER, LEFT, RIGHT, FULL;

  public String wireName() { return name().toLowerCase(Locale.ROOT); }

  public static Optional<JoinType> fromWireName(String s) {
    if (s == null) return Optional.empty();
    try {
      return Optional.of(valueOf(s.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
