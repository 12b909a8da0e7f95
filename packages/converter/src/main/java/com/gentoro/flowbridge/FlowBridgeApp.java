package com.gentoro.flowbridge;

import com.gentoro.flowbridge.exception.ExceptionUtil;
import com.gentoro.flowbridge.utility.JacksonUtility;

public class FlowBridgeApp {

  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(FlowBridgeApp.class);

  public static void main(String[] args) {
    try {
      FlowBridge app = new FlowBridge(args);
      app.initialize();
      if (!app.run(System.in, System.out)) {
        System.exit(2);
      }
    } catch (Exception e) {
      log.error("Conversion failed: {}", ExceptionUtil.extractErrorMessage(e));
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      System.err.println(JacksonUtility.toPrettyJson(ExceptionUtil.toErrorDetails(e)));
      System.exit(1);
    }
  }
}
