package io.intellixity.objectql.query;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

public final class QueryValues {
  private QueryValues() {}

  public static QueryValue nullValue() { return QueryValue.NullValue.INSTANCE; }

  public static QueryValue.FieldRef field(String path) { return new QueryValue.FieldRef(path); }

  public static QueryValue.SequenceValue sequence(Object... items) {
    List<QueryValue> out = new ArrayList<>(items.length);
    for (Object o : items) out.add(of(o));
    return new QueryValue.SequenceValue(out);
  }

  /**
   * Lifts a plain Java value (as produced by JSON parsing) into the {@link QueryValue} variant.
   *
   * @throws QueryValidationException {@link QueryErrorCode#MALFORMED_NODE} for unsupported types
   */
  public static QueryValue of(Object o) {
    if (o == null) return QueryValue.NullValue.INSTANCE;
    if (o instanceof QueryValue qv) return qv;
    if (o instanceof Boolean b) return new QueryValue.BoolValue(b);
    if (o instanceof BigDecimal bd) return new QueryValue.NumberValue(bd);
    if (o instanceof BigInteger bi) return new QueryValue.NumberValue(new BigDecimal(bi));
    if (o instanceof Double || o instanceof Float) {
      double d = ((Number) o).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, "Non-finite number: " + d);
      }
      return new QueryValue.NumberValue(BigDecimal.valueOf(d));
    }
    if (o instanceof Number n) return new QueryValue.NumberValue(BigDecimal.valueOf(n.longValue()));
    if (o instanceof CharSequence cs) return new QueryValue.StringValue(cs.toString());
    if (o instanceof Enum<?> e) return new QueryValue.StringValue(e.name());
    if (o instanceof Collection<?> c) {
      List<QueryValue> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(of(x));
      return new QueryValue.SequenceValue(out);
    }
    if (o.getClass().isArray()) {
      int len = Array.getLength(o);
      List<QueryValue> out = new ArrayList<>(len);
      for (int i = 0; i < len; i++) out.add(of(Array.get(o, i)));
      return new QueryValue.SequenceValue(out);
    }
    if (o instanceof Map<?, ?> m) {
      // {"$field": "a.b"} is a column reference, not a literal map
      if (m.size() == 1 && m.get("$field") instanceof String path) return new QueryValue.FieldRef(path);
      Map<String, QueryValue> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), of(e.getValue()));
      return new QueryValue.MapValue(out);
    }
    throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE,
        "Unsupported value type: " + o.getClass().getName());
  }

  /** Cursor maps and similar key/value payloads. */
  public static Map<String, QueryValue> ofMap(Map<String, ?> m) {
    if (m == null) return Map.of();
    Map<String, QueryValue> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) out.put(e.getKey(), of(e.getValue()));
    return Collections.unmodifiableMap(out);
  }
}
