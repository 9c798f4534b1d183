package io.intellixity.objectql.query.join;

import io.intellixity.objectql.query.QueryEnvelope;

import java.util.Objects;

/** What a join attaches: another object by name, or an inline subquery owning its own envelope. */
public interface JoinTarget {
  /** Object name the target reads from. */
  String objectName();

  static ObjectRef object(String name) { return new ObjectRef(name); }

  static Subquery subquery(QueryEnvelope query) { return new Subquery(query); }

  record ObjectRef(String name) implements JoinTarget {
    public ObjectRef {
      Objects.requireNonNull(name, "name");
    }
    @Override public String objectName() { return name; }
  }

  record Subquery(QueryEnvelope query) implements JoinTarget {
    public Subquery {
      Objects.requireNonNull(query, "query");
    }
    @Override public String objectName() { return query.object(); }
  }
}
