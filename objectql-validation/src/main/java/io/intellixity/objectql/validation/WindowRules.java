package io.intellixity.objectql.validation;

import io.intellixity.objectql.query.NodePath;
import io.intellixity.objectql.query.QueryErrorCode;
import io.intellixity.objectql.query.QueryValidationException;
import io.intellixity.objectql.query.SortSpec;
import io.intellixity.objectql.query.window.FrameBound;
import io.intellixity.objectql.query.window.WindowFrame;
import io.intellixity.objectql.query.window.WindowFunctionSpec;
import io.intellixity.objectql.query.window.WindowSpec;

public final class WindowRules {
  private WindowRules() {}

  public static void check(WindowFunctionSpec fn, NodePath path) {
    boolean hasField = fn.field() != null && !fn.field().isBlank();
    if (fn.function().isRanking() && fn.field() != null) {
      throw new QueryValidationException(QueryErrorCode.RANKING_FUNCTION_WITH_FIELD, path.key("field"),
          fn.function().wireName() + " does not take a field");
    }
    if (!fn.function().isRanking() && !hasField) {
      throw new QueryValidationException(QueryErrorCode.OFFSET_FUNCTION_WITHOUT_FIELD, path.key("field"),
          fn.function().wireName() + " needs a field");
    }
    if (fn.alias().isBlank()) {
      throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, path.key("alias"), "blank alias");
    }

    WindowSpec over = fn.over();
    NodePath overPath = path.key("over");
    for (int i = 0; i < over.partitionBy().size(); i++) {
      if (over.partitionBy().get(i).isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, overPath.key("partitionBy").index(i),
            "blank partition field");
      }
    }
    for (int i = 0; i < over.orderBy().size(); i++) {
      SortSpec s = over.orderBy().get(i);
      if (s.field().isBlank()) {
        throw new QueryValidationException(QueryErrorCode.MALFORMED_NODE, overPath.key("orderBy").index(i).key("field"),
            "blank sort field");
      }
    }

    WindowFrame frame = over.frame();
    if (frame == null) return;
    NodePath framePath = overPath.key("frame");
    if (over.orderBy().isEmpty()) {
      throw new QueryValidationException(QueryErrorCode.FRAME_WITHOUT_ORDER, framePath, "a window frame needs orderBy");
    }
    checkBound(frame.start(), framePath.key("start"));
    checkBound(frame.end(), framePath.key("end"));
    if (frame.start().kind() == FrameBound.Kind.UNBOUNDED_FOLLOWING) {
      throw new QueryValidationException(QueryErrorCode.INVALID_WINDOW_FRAME, framePath.key("start"),
          "frame cannot start at UNBOUNDED FOLLOWING");
    }
    if (frame.end().kind() == FrameBound.Kind.UNBOUNDED_PRECEDING) {
      throw new QueryValidationException(QueryErrorCode.INVALID_WINDOW_FRAME, framePath.key("end"),
          "frame cannot end at UNBOUNDED PRECEDING");
    }
    if (frame.start().position() > frame.end().position()) {
      throw new QueryValidationException(QueryErrorCode.INVALID_WINDOW_FRAME, framePath,
          "frame starts after it ends: " + frame.start() + " .. " + frame.end());
    }
  }

  private static void checkBound(FrameBound b, NodePath path) {
    if (b.offset() < 0) {
      throw new QueryValidationException(QueryErrorCode.INVALID_WINDOW_FRAME, path, "negative frame offset " + b.offset());
    }
  }
}
