package io.intellixity.objectql.query;

import java.util.*;

/** Closed set of predicate operators; each one fixes the shape of value it accepts. */
public enum ComparisonOperator {
  EQ("=", ValueShape.EQUALITY),
  NE("!=", ValueShape.EQUALITY),
  GT(">", ValueShape.ORDERED),
  GE(">=", ValueShape.ORDERED),
  LT("<", ValueShape.ORDERED),
  LE("<=", ValueShape.ORDERED),

  STARTS_WITH("starts_with", ValueShape.TEXT),
  CONTAINS("contains", ValueShape.TEXT),
  NOT_CONTAINS("not_contains", ValueShape.TEXT),

  BETWEEN("between", ValueShape.PAIR),
  IN("in", ValueShape.NON_EMPTY_SEQUENCE),
  NOT_IN("not_in", ValueShape.NON_EMPTY_SEQUENCE),

  IS_NULL("is_null", ValueShape.NONE),
  IS_NOT_NULL("is_not_null", ValueShape.NONE);

  /** Value class an operator admits. */
  public enum ValueShape {
    /** Any scalar, null included. */
    EQUALITY,
    /** Number, string or field reference. */
    ORDERED,
    TEXT,
    /** Exactly two bounds. */
    PAIR,
    NON_EMPTY_SEQUENCE,
    NONE
  }

  private static final Map<String, ComparisonOperator> BY_SYMBOL = new HashMap<>();

  static {
    for (ComparisonOperator op : values()) BY_SYMBOL.put(op.symbol, op);
    // wire aliases accepted on input only
    BY_SYMBOL.put("==", EQ);
    BY_SYMBOL.put("<>", NE);
    BY_SYMBOL.put("startswith", STARTS_WITH);
    BY_SYMBOL.put("notcontains", NOT_CONTAINS);
    BY_SYMBOL.put("nin", NOT_IN);
  }

  private final String symbol;
  private final ValueShape shape;

  ComparisonOperator(String symbol, ValueShape shape) {
    this.symbol = symbol;
    this.shape = shape;
  }

  /** Canonical wire spelling ({@code ">="}, {@code "not_in"}, ...). */
  public String symbol() { return symbol; }

  public ValueShape shape() { return shape; }

  /** Looks up an operator by wire symbol (case-insensitive); empty when unknown. */
  public static Optional<ComparisonOperator> fromSymbol(String symbol) {
    if (symbol == null) return Optional.empty();
    return Optional.ofNullable(BY_SYMBOL.get(symbol.trim().toLowerCase(Locale.ROOT)));
  }
}
