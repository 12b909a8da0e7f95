package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.model.Connection;
import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.model.WorkflowGraph;
import com.gentoro.flowbridge.model.WorkflowNode;
import java.util.List;

/** Reads and writes one platform's native workflow document. */
public interface WorkflowCodec {

  Platform platform();

  /** Normalizes a validated document into a graph; missing ids are generated. */
  WorkflowGraph read(JsonNode document, ConversionLogCollector logs);

  /**
   * Builds the native document. Connection endpoints are node ids of {@code nodes}; an endpoint
   * that matches no node is written as the raw reference it carries.
   */
  ObjectNode write(
      String name, List<WorkflowNode> nodes, List<Connection> connections, ConversionLogCollector logs);

  /** The document with no nodes, returned when the input cannot be converted. */
  ObjectNode emptySkeleton(String name);

  /** Canvas coordinate as JSON; whole numbers are written without a fraction. */
  static JsonNode coordinate(double value) {
    if (value != Math.rint(value) || Double.isInfinite(value)) {
      return DoubleNode.valueOf(value);
    }
    return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE
        ? IntNode.valueOf((int) value)
        : LongNode.valueOf((long) value);
  }

  static WorkflowCodec forPlatform(Platform platform) {
    return switch (platform) {
      case N8N -> new N8nWorkflowCodec();
      case MAKE -> new MakeWorkflowCodec();
    };
  }
}
