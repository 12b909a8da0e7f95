package com.gentoro.flowbridge.exception;

/** Errors while reading or validating a mapping database document. */
public class MappingDatabaseException extends FlowBridgeException {
  public MappingDatabaseException(String message) {
    super(FlowBridgeErrorCode.MAPPING_ERROR, message);
  }

  public MappingDatabaseException(String message, Throwable cause) {
    super(FlowBridgeErrorCode.MAPPING_ERROR, message, cause);
  }
}
