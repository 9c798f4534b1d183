package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.*;
import io.intellixity.objectql.query.join.JoinSpec;
import io.intellixity.objectql.query.join.JoinTarget;
import io.intellixity.objectql.query.window.WindowFunctionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Structural validation and canonicalization of {@link QueryEnvelope}s.
 *
 * <p>Validation is all-or-nothing and fail-fast: {@link #validate(QueryEnvelope)} returns a {@link CanonicalQuery}
 * or throws the first {@link QueryValidationException} it meets, in this order: pagination, selection, where,
 * joins (recursing into subqueries), grouping rules, having, window functions, orderBy.</p>
 *
 * <p>Only shape and consistency are checked here. Whether objects and fields exist is the metadata collaborator's
 * concern, see {@link io.intellixity.objectql.validation.metadata.MetadataQueryValidator}.</p>
 *
 * <p>Stateless apart from its options; safe to share between threads.</p>
 */
public final class QueryValidator {
  private static final Logger log = LoggerFactory.getLogger(QueryValidator.class);

  private final ValidatorOptions options;

  public QueryValidator() {
    this(ValidatorOptions.defaults());
  }

  public QueryValidator(ValidatorOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public ValidatorOptions options() { return options; }

  public CanonicalQuery validate(QueryEnvelope q) {
    Objects.requireNonNull(q, "q");
    try {
      checkEnvelope(q, NodePath.root(), 0);
    } catch (QueryValidationException e) {
      if (log.isDebugEnabled()) {
        log.debug("objectql.validate_failed object={} code={} path={}", q.object(), e.code(), e.path());
      }
      throw e;
    }
    CanonicalQuery c = new CanonicalQuery(QueryCanonicalizer.canonicalize(q));
    if (log.isDebugEnabled()) {
      log.debug("objectql.validate object={} joins={} aggregate={} windows={} pagination={}",
          q.object(), q.joins().size(), q.isAggregate(), q.windowFunctions().size(),
          q.pagination() == null ? "none" : q.pagination().getClass().getSimpleName());
    }
    if (log.isTraceEnabled()) log.trace("objectql.validate canonical={}", c.cacheKey());
    return c;
  }

  /** Shape check of a standalone filter tree. */
  public void evaluateShape(FilterExpression e) {
    Objects.requireNonNull(e, "e");
    FilterShapes.check(e, NodePath.root(), options.maxExpressionDepth());
  }

  public void validateSelection(List<FieldSelection> fields) {
    SelectionRules.check(fields, NodePath.root(), options.maxExpressionDepth());
  }

  public void checkAggregationConsistency(QueryEnvelope q) {
    AggregationRules.check(q, NodePath.root());
  }

  public void checkWindowConsistency(WindowFunctionSpec fn) {
    WindowRules.check(fn, NodePath.root());
  }

  /** Validates sibling joins of a root-level query, recursing into subqueries. */
  public void validateJoins(List<JoinSpec> joins) {
    checkJoins(joins, NodePath.root().key("joins"), 0);
  }

  private void checkEnvelope(QueryEnvelope q, NodePath path, int level) {
    checkPagination(q.pagination(), path);

    if (q.object().isBlank()) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("object"), "blank object name");
    }

    SelectionRules.check(q.fields(), path.key("fields"), options.maxExpressionDepth());

    if (q.where() != null) FilterShapes.check(q.where(), path.key("where"), options.maxExpressionDepth());

    checkJoins(q.joins(), path.key("joins"), level);

    for (int i = 0; i < q.groupBy().size(); i++) {
      if (q.groupBy().get(i).isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("groupBy").index(i), "blank groupBy field");
      }
    }
    AggregationRules.check(q, path);

    if (q.having() != null) FilterShapes.check(q.having(), path.key("having"), options.maxExpressionDepth());

    checkWindows(q, path);

    for (int i = 0; i < q.orderBy().size(); i++) {
      if (q.orderBy().get(i).field().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("orderBy").index(i).key("field"),
            "blank sort field");
      }
    }
  }

  private static void checkPagination(Pagination p, NodePath path) {
    if (p == null) return;
    if (p.limit() != null && p.limit() < 0) {
      throw new QueryValidationException(QueryErrorCode.NEGATIVE_LIMIT, path.key("limit"), "limit must be >= 0, got " + p.limit());
    }
    if (p instanceof OffsetPagination op && op.offset() != null && op.offset() < 0) {
      throw new QueryValidationException(QueryErrorCode.NEGATIVE_OFFSET, path.key("offset"), "offset must be >= 0, got " + op.offset());
    }
  }

  private void checkJoins(List<JoinSpec> joins, NodePath path, int level) {
    Set<String> qualifiers = new HashSet<>();
    for (int i = 0; i < joins.size(); i++) {
      JoinSpec j = joins.get(i);
      NodePath at = path.index(i);

      if (j.alias() != null && j.alias().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at.key("alias"), "blank join alias");
      }
      if (j.target().objectName().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, at.key("target"), "blank join target");
      }
      // an unaliased join is qualified by its object name, so it collides like an alias would
      if (!qualifiers.add(j.qualifier())) {
        throw new QueryValidationException(QueryErrorCode.DUPLICATE_JOIN_ALIAS,
            at.key(j.alias() != null ? "alias" : "target"),
            "join qualifier '" + j.qualifier() + "' is already used by a sibling join");
      }

      FilterShapes.check(j.on(), at.key("on"), options.maxExpressionDepth());
      if (!JoinConditions.references(j.on(), j.qualifier())) {
        throw new QueryValidationException(QueryErrorCode.JOIN_CONDITION_UNBOUND, at.key("on"),
            "join condition never references '" + j.qualifier() + ".*'");
      }

      if (j.target() instanceof JoinTarget.Subquery s) {
        int next = level + 1;
        if (next > options.maxJoinDepth()) {
          throw new QueryValidationException(QueryErrorCode.JOIN_NESTING_TOO_DEEP, at.key("target"),
              "subqueries nest deeper than " + options.maxJoinDepth() + " levels");
        }
        checkEnvelope(s.query(), at.key("target"), next);
      }
    }
  }

  private static void checkWindows(QueryEnvelope q, NodePath path) {
    Set<String> outputs = new HashSet<>();
    for (var a : q.aggregations()) outputs.add(a.alias());
    for (int i = 0; i < q.windowFunctions().size(); i++) {
      WindowFunctionSpec fn = q.windowFunctions().get(i);
      NodePath at = path.key("windowFunctions").index(i);
      WindowRules.check(fn, at);
      if (!outputs.add(fn.alias())) {
        throw new QueryValidationException(QueryErrorCode.DUPLICATE_WINDOW_ALIAS, at.key("alias"),
            "window alias '" + fn.alias() + "' clashes with another output column");
      }
    }
  }
}
