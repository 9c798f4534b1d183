package io.intellixity.objectql.query.window;

import java.util.Objects;

public record WindowFrame(FrameMode mode, FrameBound start, FrameBound end) {
  public WindowFrame {
    mode = (mode == null) ? FrameMode.ROWS : mode;
    Objects.requireNonNull(start, "start");
    end = (end == null) ? FrameBound.CURRENT_ROW : end;
  }

  public static WindowFrame rows(FrameBound start, FrameBound end) { return new WindowFrame(FrameMode.ROWS, start, end); }
  public static WindowFrame range(FrameBound start, FrameBound end) { return new WindowFrame(FrameMode.RANGE, start, end); }
}
