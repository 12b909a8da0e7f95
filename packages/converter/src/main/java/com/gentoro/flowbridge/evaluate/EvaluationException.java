package com.gentoro.flowbridge.evaluate;

import com.gentoro.flowbridge.exception.FlowBridgeErrorCode;
import com.gentoro.flowbridge.exception.FlowBridgeException;

/** Evaluation of one expression was abandoned. */
public class EvaluationException extends FlowBridgeException {

  public enum Kind {
    UNKNOWN_FUNCTION,
    TYPE_MISMATCH,
    BUDGET_EXCEEDED
  }

  private final Kind kind;

  public EvaluationException(Kind kind, String message) {
    super(FlowBridgeErrorCode.EVALUATION_ERROR, message);
    this.kind = kind;
  }

  public EvaluationException(Kind kind, String message, Throwable cause) {
    super(FlowBridgeErrorCode.EVALUATION_ERROR, message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public static EvaluationException typeMismatch(String function, String detail) {
    return new EvaluationException(Kind.TYPE_MISMATCH, function + ": " + detail);
  }
}
