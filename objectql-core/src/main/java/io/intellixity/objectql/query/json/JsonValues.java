package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.objectql.query.NodePath;
import io.intellixity.objectql.query.QueryErrorCode;
import io.intellixity.objectql.query.QueryValidationException;
import io.intellixity.objectql.query.QueryValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/** {@link JsonNode} &lt;-&gt; {@link QueryValue} conversions plus small typed readers shared by the codec. */
final class JsonValues {
  static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);
  static final String FIELD_REF_KEY = "$field";

  private JsonValues() {}

  static QueryValue toValue(JsonNode n, NodePath path) {
    if (n == null || n.isNull() || n.isMissingNode()) return QueryValue.NullValue.INSTANCE;
    if (n.isBoolean()) return new QueryValue.BoolValue(n.booleanValue());
    if (n.isIntegralNumber()) return new QueryValue.NumberValue(new BigDecimal(n.bigIntegerValue()));
    if (n.isNumber()) {
      if (n.isDouble() || n.isFloat()) {
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "Non-finite number");
        }
      }
      return new QueryValue.NumberValue(n.decimalValue());
    }
    if (n.isTextual()) return new QueryValue.StringValue(n.textValue());
    if (n.isArray()) {
      List<QueryValue> out = new ArrayList<>(n.size());
      for (int i = 0; i < n.size(); i++) out.add(toValue(n.get(i), path.index(i)));
      return new QueryValue.SequenceValue(out);
    }
    if (n.isObject()) {
      JsonNode ref = n.get(FIELD_REF_KEY);
      if (n.size() == 1 && ref != null) {
        if (!ref.isTextual() || ref.textValue().isBlank()) {
          throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key(FIELD_REF_KEY),
              "$field must be a non-blank string");
        }
        return new QueryValue.FieldRef(ref.textValue());
      }
      Map<String, QueryValue> out = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = n.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        out.put(e.getKey(), toValue(e.getValue(), path.key(e.getKey())));
      }
      return new QueryValue.MapValue(out);
    }
    throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "Unsupported JSON value: " + n.getNodeType());
  }

  static JsonNode toJson(QueryValue v) {
    if (v == null || v.isNull()) return NODES.nullNode();
    if (v instanceof QueryValue.BoolValue b) return NODES.booleanNode(b.value());
    if (v instanceof QueryValue.NumberValue n) return number(n.value());
    if (v instanceof QueryValue.StringValue s) return NODES.textNode(s.value());
    if (v instanceof QueryValue.FieldRef r) {
      ObjectNode o = NODES.objectNode();
      o.put(FIELD_REF_KEY, r.path());
      return o;
    }
    if (v instanceof QueryValue.SequenceValue seq) {
      ArrayNode a = NODES.arrayNode();
      for (QueryValue x : seq.items()) a.add(toJson(x));
      return a;
    }
    if (v instanceof QueryValue.MapValue m) {
      ObjectNode o = NODES.objectNode();
      new TreeMap<>(m.entries()).forEach((k, x) -> o.set(k, toJson(x)));
      return o;
    }
    throw new IllegalArgumentException("Unsupported QueryValue: " + v.getClass().getName());
  }

  /** Integral values are written without a fraction so {@code 1000} never becomes {@code 1E+3}. */
  static JsonNode number(BigDecimal bd) {
    BigDecimal stripped = bd.stripTrailingZeros();
    if (stripped.scale() <= 0) {
      BigInteger bi = stripped.toBigIntegerExact();
      if (bi.bitLength() < 64) return NODES.numberNode(bi.longValue());
      return NODES.numberNode(bi);
    }
    return NODES.numberNode(stripped);
  }

  static String text(JsonNode n, NodePath path, boolean required) {
    if (n == null || n.isNull() || n.isMissingNode()) {
      if (required) throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "required string is missing");
      return null;
    }
    if (!n.isTextual()) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected a string, got " + n.getNodeType());
    }
    return n.textValue();
  }

  static Integer integer(JsonNode n, NodePath path) {
    if (n == null || n.isNull() || n.isMissingNode()) return null;
    if (n.isIntegralNumber() && n.canConvertToInt()) return n.intValue();
    // 10.0 is accepted, 10.5 is not
    if (n.isNumber()) {
      BigDecimal d = n.decimalValue();
      try {
        return d.intValueExact();
      } catch (ArithmeticException e) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected an integer, got " + n, e);
      }
    }
    throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected an integer, got " + n.getNodeType());
  }

  static boolean bool(JsonNode n, NodePath path) {
    if (n == null || n.isNull() || n.isMissingNode()) return false;
    if (!n.isBoolean()) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected a boolean, got " + n.getNodeType());
    }
    return n.booleanValue();
  }

  static List<String> strings(JsonNode n, NodePath path) {
    if (n == null || n.isNull() || n.isMissingNode()) return List.of();
    if (!n.isArray()) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected an array of strings");
    }
    List<String> out = new ArrayList<>(n.size());
    for (int i = 0; i < n.size(); i++) out.add(text(n.get(i), path.index(i), true));
    return out;
  }

  static ArrayNode array(JsonNode n, NodePath path) {
    if (!(n instanceof ArrayNode a)) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected an array");
    }
    return a;
  }

  static ObjectNode object(JsonNode n, NodePath path) {
    if (!(n instanceof ObjectNode o)) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "expected an object");
    }
    return o;
  }

  static boolean isAbsent(JsonNode n) {
    return n == null || n.isNull() || n.isMissingNode();
  }
}
