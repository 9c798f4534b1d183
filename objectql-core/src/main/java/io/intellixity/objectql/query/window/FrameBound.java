package io.intellixity.objectql.query.window;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One end of a window frame: {@code UNBOUNDED PRECEDING}, {@code n PRECEDING}, {@code CURRENT ROW},
 * {@code n FOLLOWING} or {@code UNBOUNDED FOLLOWING}.
 */
public record FrameBound(Kind kind, long offset) {
  public enum Kind { UNBOUNDED_PRECEDING, PRECEDING, CURRENT_ROW, FOLLOWING, UNBOUNDED_FOLLOWING }

  public static final FrameBound UNBOUNDED_PRECEDING = new FrameBound(Kind.UNBOUNDED_PRECEDING, 0);
  public static final FrameBound CURRENT_ROW = new FrameBound(Kind.CURRENT_ROW, 0);
  public static final FrameBound UNBOUNDED_FOLLOWING = new FrameBound(Kind.UNBOUNDED_FOLLOWING, 0);

  public FrameBound {
    Objects.requireNonNull(kind, "kind");
    if (kind != Kind.PRECEDING && kind != Kind.FOLLOWING) offset = 0;
  }

  public static FrameBound preceding(long n) { return new FrameBound(Kind.PRECEDING, n); }
  public static FrameBound following(long n) { return new FrameBound(Kind.FOLLOWING, n); }

  /**
   * Signed position relative to the current row; unbounded ends map to the long extremes. Used to check that a
   * frame does not start after it ends.
   */
  public long position() {
    return switch (kind) {
      case UNBOUNDED_PRECEDING -> Long.MIN_VALUE;
      case PRECEDING -> -offset;
      case CURRENT_ROW -> 0;
      case FOLLOWING -> offset;
      case UNBOUNDED_FOLLOWING -> Long.MAX_VALUE;
    };
  }

  /** SQL-style text ({@code "6 PRECEDING"}); also the wire form. */
  public String toSql() {
    return switch (kind) {
      case UNBOUNDED_PRECEDING -> "UNBOUNDED PRECEDING";
      case PRECEDING -> offset + " PRECEDING";
      case CURRENT_ROW -> "CURRENT ROW";
      case FOLLOWING -> offset + " FOLLOWING";
      case UNBOUNDED_FOLLOWING -> "UNBOUNDED FOLLOWING";
    };
  }

  /** Parses the wire form, case- and whitespace-insensitive. Empty when the text is not a frame bound. */
  public static Optional<FrameBound> parse(String text) {
    if (text == null) return Optional.empty();
    String[] parts = text.trim().toUpperCase(Locale.ROOT).split("\\s+");
    if (parts.length != 2) return Optional.empty();
    String head = parts[0];
    String tail = parts[1];
    if (head.equals("CURRENT") && tail.equals("ROW")) return Optional.of(CURRENT_ROW);
    if (head.equals("UNBOUNDED")) {
      if (tail.equals("PRECEDING")) return Optional.of(UNBOUNDED_PRECEDING);
      if (tail.equals("FOLLOWING")) return Optional.of(UNBOUNDED_FOLLOWING);
      return Optional.empty();
    }
    long n;
    try {
      n = Long.parseLong(head);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    if (tail.equals("PRECEDING")) return Optional.of(preceding(n));
    if (tail.equals("FOLLOWING")) return Optional.of(following(n));
    return Optional.empty();
  }

  @Override
  public String toString() { return toSql(); }
}
