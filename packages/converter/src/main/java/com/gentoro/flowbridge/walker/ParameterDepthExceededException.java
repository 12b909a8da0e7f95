package com.gentoro.flowbridge.walker;

import com.gentoro.flowbridge.exception.FlowBridgeErrorCode;
import com.gentoro.flowbridge.exception.FlowBridgeException;

/** A parameter tree nests deeper than the walker accepts. */
public class ParameterDepthExceededException extends FlowBridgeException {

  private final String path;
  private final int limit;

  public ParameterDepthExceededException(String path, int limit) {
    super(
        FlowBridgeErrorCode.CONVERSION_ERROR,
        "Parameter tree exceeds maximum depth " + limit + " at '" + path + "'");
    this.path = path;
    this.limit = limit;
    withContext("path", path);
  }

  public String getPath() {
    return path;
  }

  public int getLimit() {
    return limit;
  }
}
