package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;

import java.util.*;

/** Select-list checks: no two entries at one level may produce the same output column. */
public final class SelectionRules {
  private SelectionRules() {}

  /**
   * Repeating an identical scalar is allowed (canonicalization drops the copy); any other clash of output names at
   * the same level is ambiguous.
   */
  public static void check(List<FieldSelection> fields, NodePath path, int maxDepth) {
    if (fields == null) return;
    walk(fields, path, 1, maxDepth);
  }

  private static void walk(List<FieldSelection> fields, NodePath path, int depth, int maxDepth) {
    if (depth > maxDepth) {
      throw new QueryValidationException(QueryErrorCode.EXPRESSION_NESTING_TOO_DEEP, path,
          "selection nests deeper than " + maxDepth + " levels");
    }
    Map<String, FieldSelection> seen = new HashMap<>();
    for (int i = 0; i < fields.size(); i++) {
      FieldSelection f = fields.get(i);
      NodePath at = path.index(i);
      if (f.name().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at, "blank field name");
      }
      if (f instanceof FieldSelection.Relation r && r.alias() != null && r.alias().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at.key("alias"), "blank alias");
      }
      FieldSelection prev = seen.putIfAbsent(f.outputName(), f);
      if (prev != null && !(prev instanceof FieldSelection.Scalar && prev.equals(f))) {
        throw new QueryValidationException(QueryErrorCode.DUPLICATE_SELECTION_ALIAS, at,
            "output column '" + f.outputName() + "' is selected more than once");
      }
      if (f instanceof FieldSelection.Relation r) {
        walk(r.subSelections(), at.key("fields"), depth + 1, maxDepth);
      }
    }
  }
}
