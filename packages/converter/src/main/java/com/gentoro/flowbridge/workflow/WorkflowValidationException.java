package com.gentoro.flowbridge.workflow;

import com.gentoro.flowbridge.exception.FlowBridgeErrorCode;
import com.gentoro.flowbridge.exception.FlowBridgeException;

/** The input document lacks the top-level shape its platform requires. */
public class WorkflowValidationException extends FlowBridgeException {
  public WorkflowValidationException(String message) {
    super(FlowBridgeErrorCode.CONVERSION_ERROR, message);
  }
}
