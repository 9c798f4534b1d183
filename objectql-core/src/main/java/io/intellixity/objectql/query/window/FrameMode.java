package io.intellixity.objectql.query.window;

public enum FrameMode { ROWS, RANGE }
