package com.gentoro.flowbridge.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the FlowBridge exception hierarchy.
 *
 * <p>Every exception carries a {@link FlowBridgeErrorCode} and an optional context map with
 * structured details (node id, parameter path, expression text, ...). Conversions never let these
 * escape for malformed workflow content; they are caught at component boundaries and reported as
 * conversion logs instead.
 */
public class FlowBridgeException extends RuntimeException {

  private final FlowBridgeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public FlowBridgeException(FlowBridgeErrorCode code, String message) {
    super(message);
    this.code = code == null ? FlowBridgeErrorCode.UNKNOWN : code;
  }

  public FlowBridgeException(FlowBridgeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? FlowBridgeErrorCode.UNKNOWN : code;
  }

  public FlowBridgeErrorCode getCode() {
    return code;
  }

  /** Attach a context entry; returns {@code this} for chaining at the throw site. */
  public FlowBridgeException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }
}
