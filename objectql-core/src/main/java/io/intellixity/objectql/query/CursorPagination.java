package io.intellixity.objectql.query;

import java.util.Map;

/**
 * Cursor (keyset) paging.
 *
 * <p>The cursor is an opaque key/value map, typically the last-seen values of the active sort fields.
 * Executors use it to build a lexicographic "after" predicate.</p>
 */
public record CursorPagination(Map<String, QueryValue> cursor, Integer limit) implements Pagination {
  public CursorPagination {
    cursor = (cursor == null) ? Map.of() : QueryValues.ofMap(cursor);
  }
}
