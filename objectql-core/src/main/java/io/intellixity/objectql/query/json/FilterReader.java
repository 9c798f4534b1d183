package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.objectql.query.*;

import java.util.*;

/**
 * Reads a filter tree from its wire form.
 *
 * <p>Canonical array form: {@code [field, operator, value]} leaves, {@code ["and", e1, ...]},
 * {@code ["or", e1, ...]} and {@code ["not", e]}. An array is a group only when its head is
 * {@code and|or|not} and every other element is itself an array, so a column named "and" still reads as a leaf.</p>
 *
 * <p>Operator-object form: {@code {status: "active", age: {$gte: 18}, $or: [...], profile: {verified: true}}}.
 * Entries are AND-ed, plain nested objects become dotted relation paths, and each {@code $op} is mapped onto
 * the closed operator set.</p>
 */
final class FilterReader {
  private static final Map<String, ComparisonOperator> DOLLAR_OPS = Map.ofEntries(
      Map.entry("$eq", ComparisonOperator.EQ),
      Map.entry("$ne", ComparisonOperator.NE),
      Map.entry("$gt", ComparisonOperator.GT),
      Map.entry("$gte", ComparisonOperator.GE),
      Map.entry("$lt", ComparisonOperator.LT),
      Map.entry("$lte", ComparisonOperator.LE),
      Map.entry("$in", ComparisonOperator.IN),
      Map.entry("$nin", ComparisonOperator.NOT_IN),
      Map.entry("$between", ComparisonOperator.BETWEEN),
      Map.entry("$contains", ComparisonOperator.CONTAINS),
      Map.entry("$notContains", ComparisonOperator.NOT_CONTAINS),
      Map.entry("$startsWith", ComparisonOperator.STARTS_WITH)
  );

  private FilterReader() {}

  /** Null/absent input and an empty operator object both read as "no filter". */
  static FilterExpression read(JsonNode n, NodePath path) {
    if (JsonValues.isAbsent(n)) return null;
    if (n.isArray()) return readArray(n, path);
    if (n.isObject()) return readObject(n, path, "");
    throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path,
        "filter must be an array or an object, got " + n.getNodeType());
  }

  /** Like {@link #read} but a missing filter is an error. */
  static FilterExpression readRequired(JsonNode n, NodePath path) {
    FilterExpression e = read(n, path);
    if (e == null) throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "filter is required");
    return e;
  }

  static boolean isGroup(JsonNode n) {
    if (!n.isArray() || n.size() == 0 || !n.get(0).isTextual()) return false;
    String head = n.get(0).textValue().toLowerCase(Locale.ROOT);
    if (!head.equals("and") && !head.equals("or") && !head.equals("not")) return false;
    for (int i = 1; i < n.size(); i++) if (!n.get(i).isArray()) return false;
    return true;
  }

  static boolean isLeaf(JsonNode n) {
    if (!n.isArray() || n.size() < 2 || n.size() > 3) return false;
    if (!n.get(0).isTextual() || !n.get(1).isTextual()) return false;
    return ComparisonOperator.fromSymbol(n.get(1).textValue()).isPresent();
  }

  private static FilterExpression readArray(JsonNode n, NodePath path) {
    if (isGroup(n)) {
      String head = n.get(0).textValue().toLowerCase(Locale.ROOT);
      if (head.equals("not")) {
        if (n.size() != 2) {
          throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path,
              "not takes exactly one operand, got " + (n.size() - 1));
        }
        return new NotExpression(readArray(n.get(1), path.key("operand")));
      }
      Clause clause = head.equals("or") ? Clause.OR : Clause.AND;
      List<FilterExpression> operands = new ArrayList<>(n.size() - 1);
      NodePath opsPath = path.key("operands");
      for (int i = 1; i < n.size(); i++) operands.add(readArray(n.get(i), opsPath.index(i - 1)));
      return group(clause, operands, path);
    }
    if (n.size() >= 2 && n.get(0).isTextual() && n.get(1).isTextual()) {
      String symbol = n.get(1).textValue();
      ComparisonOperator op = ComparisonOperator.fromSymbol(symbol).orElseThrow(() ->
          new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("operator"),
              "unknown operator '" + symbol + "'"));
      if (n.size() == 2 && op.shape() != ComparisonOperator.ValueShape.NONE) {
        throw new QueryValidationException(QueryErrorCode.OPERATOR_ARITY_MISMATCH, path.key("value"),
            "operator '" + op.symbol() + "' needs a value");
      }
      if (n.size() > 3) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path,
            "predicate must be [field, operator, value], got " + n.size() + " elements");
      }
      QueryValue value = (n.size() == 3) ? JsonValues.toValue(n.get(2), path.key("value")) : null;
      return new Predicate(n.get(0).textValue(), op, value);
    }
    throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path,
        "expected [field, operator, value] or [and|or|not, ...], got " + n);
  }

  private static FilterExpression readObject(JsonNode n, NodePath path, String prefix) {
    List<FilterExpression> parts = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = n.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String key = e.getKey();
      JsonNode v = e.getValue();
      NodePath at = path.key(key);

      if (key.equals("$and") || key.equals("$or")) {
        JsonNode arr = JsonValues.array(v, at);
        List<FilterExpression> operands = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) {
          FilterExpression child = readNested(arr.get(i), at.index(i), prefix);
          if (child != null) operands.add(child);
        }
        parts.add(group(key.equals("$or") ? Clause.OR : Clause.AND, operands, at));
      } else if (key.equals("$not")) {
        FilterExpression child = readNested(v, at, prefix);
        if (child == null) {
          throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at, "$not needs a condition");
        }
        parts.add(new NotExpression(child));
      } else if (key.startsWith("$")) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at, "unknown logical operator '" + key + "'");
      } else {
        readField(prefix + key, v, at, parts);
      }
    }
    if (parts.isEmpty()) return null;
    if (parts.size() == 1) return parts.get(0);
    return group(Clause.AND, parts, path);
  }

  private static FilterExpression readNested(JsonNode n, NodePath path, String prefix) {
    if (n != null && n.isArray()) return readArray(n, path);
    return readObject(JsonValues.object(n, path), path, prefix);
  }

  private static void readField(String field, JsonNode v, NodePath path, List<FilterExpression> out) {
    if (!v.isObject() || isFieldRef(v)) {
      // implicit equality
      out.add(new Predicate(field, ComparisonOperator.EQ, JsonValues.toValue(v, path)));
      return;
    }
    boolean hasOps = false;
    boolean hasPlain = false;
    Iterator<String> names = v.fieldNames();
    while (names.hasNext()) {
      if (names.next().startsWith("$")) hasOps = true; else hasPlain = true;
    }
    if (hasOps && hasPlain) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path,
          "cannot mix $operators and nested fields under '" + field + "'");
    }
    if (!hasOps) {
      // nested relation: {profile: {verified: true}} -> profile.verified = true
      FilterExpression nested = readObject(v, path, field + ".");
      if (nested != null) out.add(nested);
      return;
    }
    Iterator<Map.Entry<String, JsonNode>> it = v.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.add(operatorPredicate(field, e.getKey(), e.getValue(), path.key(e.getKey())));
    }
  }

  private static Predicate operatorPredicate(String field, String opKey, JsonNode v, NodePath path) {
    if (opKey.equals("$null")) {
      if (!v.isBoolean()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "$null takes true or false");
      }
      return new Predicate(field, v.booleanValue() ? ComparisonOperator.IS_NULL : ComparisonOperator.IS_NOT_NULL, null);
    }
    ComparisonOperator op = DOLLAR_OPS.get(opKey);
    if (op == null) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path,
          "operator '" + opKey + "' has no canonical equivalent");
    }
    return new Predicate(field, op, JsonValues.toValue(v, path));
  }

  private static boolean isFieldRef(JsonNode v) {
    return v.isObject() && v.size() == 1 && v.has(JsonValues.FIELD_REF_KEY);
  }

  private static LogicalGroup group(Clause clause, List<FilterExpression> operands, NodePath path) {
    try {
      return new LogicalGroup(clause, operands);
    } catch (QueryValidationException e) {
      throw e.under(path);
    }
  }
}
