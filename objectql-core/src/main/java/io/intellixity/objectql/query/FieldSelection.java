package io.intellixity.objectql.query;

import java.util.*;

/**
 * One entry of a select list: a scalar column or a relation projection with its own nested select list.
 */
public interface FieldSelection {
  String name();

  /** Column name this entry produces in the result (alias if present, else name). */
  String outputName();

  /** Marker for "every scalar field of the object"; produced by canonicalization when fields are omitted. */
  String WILDCARD = "*";

  static Scalar scalar(String name) { return new Scalar(name); }

  static Scalar wildcard() { return new Scalar(WILDCARD); }

  static Relation relation(String name, String alias, List<? extends FieldSelection> subSelections) {
    return new Relation(name, alias, List.copyOf(subSelections));
  }

  static Relation relation(String name, FieldSelection... subSelections) {
    return new Relation(name, null, List.of(subSelections));
  }

  record Scalar(String name) implements FieldSelection {
    public Scalar {
      Objects.requireNonNull(name, "name");
    }
    @Override public String outputName() { return name; }
    public boolean isWildcard() { return WILDCARD.equals(name); }
  }

  /**
   * Relation projection. An empty {@code subSelections} list selects the relation's default representation
   * (backend-defined), which is different from not selecting the relation at all.
   */
  record Relation(String name, String alias, List<FieldSelection> subSelections) implements FieldSelection {
    public Relation {
      Objects.requireNonNull(name, "name");
      subSelections = List.copyOf(subSelections == null ? List.of() : subSelections);
    }
    @Override public String outputName() { return alias != null ? alias : name; }
  }
}
