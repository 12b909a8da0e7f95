package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowbridge.model.Platform;

/** Structural checks on a workflow document before any node is touched. */
public final class WorkflowValidator {

  private WorkflowValidator() {}

  /**
   * Validates the required top-level shape of {@code document} for {@code platform}. Legacy Make
   * documents must be normalized first.
   *
   * @throws WorkflowValidationException describing the first problem found
   */
  public static void validate(JsonNode document, Platform platform) {
    if (document == null || !document.isObject()) {
      throw new WorkflowValidationException("Workflow document must be a JSON object");
    }
    switch (platform) {
      case N8N -> {
        requireArrayOfObjects(document, "nodes", "node");
        if (!document.path("connections").isObject()) {
          throw new WorkflowValidationException("n8n workflow requires a 'connections' object");
        }
      }
      case MAKE -> requireArrayOfObjects(document, "flow", "module");
    }
  }

  private static void requireArrayOfObjects(JsonNode document, String field, String what) {
    JsonNode array = document.get(field);
    if (array == null || !array.isArray()) {
      throw new WorkflowValidationException("Workflow requires a '" + field + "' array");
    }
    for (int i = 0; i < array.size(); i++) {
      if (!array.get(i).isObject()) {
        throw new WorkflowValidationException(
            "Entry " + i + " of '" + field + "' is not a " + what + " object");
      }
    }
  }
}
