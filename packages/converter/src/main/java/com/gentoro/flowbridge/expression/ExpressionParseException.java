package com.gentoro.flowbridge.expression;

import com.gentoro.flowbridge.exception.FlowBridgeErrorCode;
import com.gentoro.flowbridge.exception.FlowBridgeException;

/**
 * Raised by {@link ExpressionParser} for a malformed expression body. It never leaves the parser:
 * {@link ExpressionParser#parse(String, Dialect)} converts it into {@link ParseOutcome.Unparsed}.
 */
public class ExpressionParseException extends FlowBridgeException {

  private final int position;

  public ExpressionParseException(String message, int position) {
    super(FlowBridgeErrorCode.EXPRESSION_ERROR, message + " at position " + position);
    this.position = position;
  }

  public int getPosition() {
    return position;
  }
}
