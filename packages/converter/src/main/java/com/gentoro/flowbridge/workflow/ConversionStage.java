package com.gentoro.flowbridge.workflow;

/** Stages of one conversion, in the order they run. */
public enum ConversionStage {
  VALIDATE,
  MAP_NODES,
  CONVERT_CONNECTIONS,
  ASSEMBLE,
  FINALIZE
}
