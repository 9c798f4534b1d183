package io.intellixity.objectql.query;

import java.util.*;

/**
 * Location of a node inside a query tree, as a sequence of model keys and list indices.
 * <p>
 * Renders as a JSON pointer ({@code /joins/0/target/where/operands/1}) so a UI can highlight the offending node.
 */
public final class NodePath {
  private static final NodePath ROOT = new NodePath(List.of());

  private final List<Object> segments;

  private NodePath(List<Object> segments) {
    this.segments = segments;
  }

  public static NodePath root() { return ROOT; }

  public static NodePath of(Object... segments) {
    if (segments.length == 0) return ROOT;
    List<Object> out = new ArrayList<>(segments.length);
    for (Object s : segments) {
      if (s instanceof Integer i) {
        if (i < 0) throw new IllegalArgumentException("index must be >= 0");
        out.add(i);
      } else {
        out.add(String.valueOf(Objects.requireNonNull(s, "segment")));
      }
    }
    return new NodePath(Collections.unmodifiableList(out));
  }

  public NodePath key(String key) {
    Objects.requireNonNull(key, "key");
    return append(key);
  }

  public NodePath index(int index) {
    if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    return append(index);
  }

  /** Keys are {@link String}s, list positions are {@link Integer}s. */
  public List<Object> segments() { return segments; }

  public boolean isRoot() { return segments.isEmpty(); }

  /** This path followed by {@code relative}. */
  public NodePath resolve(NodePath relative) {
    if (relative.isRoot()) return this;
    if (isRoot()) return relative;
    List<Object> out = new ArrayList<>(segments.size() + relative.segments.size());
    out.addAll(segments);
    out.addAll(relative.segments);
    return new NodePath(Collections.unmodifiableList(out));
  }

  private NodePath append(Object segment) {
    List<Object> out = new ArrayList<>(segments.size() + 1);
    out.addAll(segments);
    out.add(segment);
    return new NodePath(Collections.unmodifiableList(out));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NodePath p && segments.equals(p.segments);
  }

  @Override
  public int hashCode() { return segments.hashCode(); }

  @Override
  public String toString() {
    if (segments.isEmpty()) return "/";
    StringBuilder sb = new StringBuilder();
    for (Object s : segments) {
      sb.append('/');
      // RFC 6901 escaping
      sb.append(String.valueOf(s).replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }
}
