package io.intellixity.objectql.query.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.objectql.query.NodePath;
import io.intellixity.objectql.query.QueryErrorCode;
import io.intellixity.objectql.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Wire-compatibility shim for the deprecated tuple-based query shape.
 *
 * <p>Rewrites {@code filters}, {@code sort}, {@code top} and {@code skip} into {@code where}, {@code orderBy},
 * {@code limit} and {@code offset}. Legacy filters may be a single tuple {@code ["status", "=", "active"]} or an
 * infix chain {@code [[...], "or", [...], "and", [...]]} where AND binds tighter than OR and adjacent operands
 * without a connector are AND-ed.</p>
 *
 * <p>Giving a legacy key together with its replacement is rejected instead of picking one.</p>
 */
final class LegacyQueryTranslator {
  private static final Logger log = LoggerFactory.getLogger(LegacyQueryTranslator.class);

  private static final Map<String, String> RENAMES = new LinkedHashMap<>();

  static {
    RENAMES.put("filters", "where");
    RENAMES.put("sort", "orderBy");
    RENAMES.put("top", "limit");
    RENAMES.put("skip", "offset");
  }

  private LegacyQueryTranslator() {}

  static boolean isLegacy(ObjectNode query) {
    for (String k : RENAMES.keySet()) if (query.has(k)) return true;
    return false;
  }

  /** Returns {@code query} itself when no legacy key is present, else a rewritten copy. */
  static ObjectNode translate(ObjectNode query, NodePath path) {
    if (!isLegacy(query)) return query;
    ObjectNode out = query.deepCopy();
    for (Map.Entry<String, String> r : RENAMES.entrySet()) {
      String legacy = r.getKey();
      String canonical = r.getValue();
      if (!out.has(legacy)) continue;
      if (out.has(canonical)) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key(legacy),
            "legacy '" + legacy + "' cannot be combined with '" + canonical + "'");
      }
      JsonNode v = out.remove(legacy);
      if (legacy.equals("filters")) v = filter(v, path.key(legacy));
      out.set(canonical, v);
    }
    if (log.isDebugEnabled()) {
      log.debug("objectql.json legacy_query_translated object={} path={}", query.path("object").asText(), path);
    }
    return out;
  }

  /** Converts a legacy filter into the canonical array form. Canonical input passes through unchanged. */
  static JsonNode filter(JsonNode f, NodePath path) {
    if (JsonValues.isAbsent(f) || f.isObject()) return f;
    ArrayNode a = JsonValues.array(f, path);
    if (FilterReader.isLeaf(a)) return a;
    if (FilterReader.isGroup(a)) {
      ArrayNode out = JsonValues.NODES.arrayNode();
      out.add(a.get(0));
      for (int i = 1; i < a.size(); i++) out.add(filter(a.get(i), path.index(i)));
      return out;
    }
    return infix(a, path);
  }

  private static JsonNode infix(ArrayNode a, NodePath path) {
    List<List<JsonNode>> orTerms = new ArrayList<>();
    List<JsonNode> andTerm = new ArrayList<>();
    boolean expectOperand = true;
    for (int i = 0; i < a.size(); i++) {
      JsonNode x = a.get(i);
      if (x.isTextual()) {
        String conn = x.textValue().trim().toLowerCase(Locale.ROOT);
        if (expectOperand || (!conn.equals("and") && !conn.equals("or"))) {
          throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.index(i),
              "unexpected '" + x.textValue() + "' in legacy filter");
        }
        if (conn.equals("or")) {
          orTerms.add(andTerm);
          andTerm = new ArrayList<>();
        }
        expectOperand = true;
      } else if (x.isArray()) {
        andTerm.add(filter(x, path.index(i)));
        expectOperand = false;
      } else {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.index(i),
            "legacy filter items must be arrays or 'and'/'or'");
      }
    }
    if (expectOperand && a.size() > 0) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path, "legacy filter ends with a connector");
    }
    orTerms.add(andTerm);

    List<JsonNode> ors = new ArrayList<>(orTerms.size());
    for (List<JsonNode> term : orTerms) ors.add(tagged("and", term));
    return tagged("or", ors);
  }

  /** Single operands are not wrapped; an empty list becomes an empty group so the reader reports it. */
  private static JsonNode tagged(String clause, List<JsonNode> operands) {
    if (operands.size() == 1) return operands.get(0);
    ArrayNode out = JsonValues.NODES.arrayNode();
    out.add(clause);
    operands.forEach(out::add);
    return out;
  }
}
