package io.intellixity.objectql.query;

import java.math.BigDecimal;
import java.util.*;

/**
 * Closed variant for predicate values and cursor entries.
 * <p>
 * Every operand a filter can carry is one of the nested records below, so operator admissibility checks are
 * exhaustive. Use {@link QueryValues#of(Object)} to lift plain Java values.
 */
public interface QueryValue {

  /** True for {@link NullValue}. */
  default boolean isNull() { return false; }

  /** Plain Java rendition: null, Boolean, BigDecimal, String, List, Map or a {@link FieldRef}. */
  Object unwrap();

  record NullValue() implements QueryValue {
    public static final NullValue INSTANCE = new NullValue();
    @Override public boolean isNull() { return true; }
    @Override public Object unwrap() { return null; }
  }

  record BoolValue(boolean value) implements QueryValue {
    @Override public Object unwrap() { return value; }
  }

  record NumberValue(BigDecimal value) implements QueryValue {
    public NumberValue {
      Objects.requireNonNull(value, "value");
    }
    @Override public Object unwrap() { return value; }

    // 1 and 1.0 are the same filter operand
    @Override
    public boolean equals(Object o) {
      return o instanceof NumberValue n && value.compareTo(n.value) == 0;
    }

    @Override
    public int hashCode() { return value.stripTrailingZeros().hashCode(); }
  }

  record StringValue(String value) implements QueryValue {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }
    @Override public Object unwrap() { return value; }
  }

  record SequenceValue(List<QueryValue> items) implements QueryValue {
    public SequenceValue {
      items = List.copyOf(items);
    }
    public int size() { return items.size(); }
    @Override
    public Object unwrap() {
      List<Object> out = new ArrayList<>(items.size());
      for (QueryValue v : items) out.add(v.unwrap());
      return Collections.unmodifiableList(out);
    }
  }

  record MapValue(Map<String, QueryValue> entries) implements QueryValue {
    public MapValue {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
    @Override
    public Object unwrap() {
      Map<String, Object> out = new LinkedHashMap<>();
      entries.forEach((k, v) -> out.put(k, v.unwrap()));
      return Collections.unmodifiableMap(out);
    }
  }

  /** Reference to another column ({@code {"$field": "order.owner_id"}}) rather than a literal. */
  record FieldRef(String path) implements QueryValue {
    public FieldRef {
      Objects.requireNonNull(path, "path");
      if (path.isBlank()) throw new IllegalArgumentException("FieldRef path is blank");
    }
    @Override public Object unwrap() { return this; }
  }
}
