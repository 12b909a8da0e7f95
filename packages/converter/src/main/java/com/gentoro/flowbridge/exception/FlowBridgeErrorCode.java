package com.gentoro.flowbridge.exception;

/** Coarse classification of failures raised inside FlowBridge. */
public enum FlowBridgeErrorCode {
  CONFIGURATION_ERROR,
  MAPPING_ERROR,
  EXPRESSION_ERROR,
  EVALUATION_ERROR,
  CONVERSION_ERROR,
  UNKNOWN
}
