package io.intellixity.objectql.query;

/**
 * Pagination mode of a query: {@link OffsetPagination} or {@link CursorPagination}, never both.
 * A query without pagination is unbounded (capping is left to the executor).
 */
public interface Pagination {
  /** Max rows, or null when not capped. Zero is valid and means "no rows". */
  Integer limit();
}
