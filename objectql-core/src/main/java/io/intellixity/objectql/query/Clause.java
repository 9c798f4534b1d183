package io.intellixity.objectql.query;

public enum Clause {
  AND, OR;

  public String wireName() { return name().toLowerCase(java.util.Locale.ROOT); }
}
