package io.intellixity.objectql.query;

/** Limit/offset paging. Range checks (negative limit/offset) are done by the validator. */
public record OffsetPagination(Integer limit, Integer offset) implements Pagination {
  public static OffsetPagination limit(int limit) { return new OffsetPagination(limit, null); }
}
