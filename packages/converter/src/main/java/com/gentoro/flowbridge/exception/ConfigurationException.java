package com.gentoro.flowbridge.exception;

/** Raised when the application configuration cannot be located or parsed. */
public class ConfigurationException extends FlowBridgeException {
  public ConfigurationException(String message) {
    super(FlowBridgeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(FlowBridgeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
