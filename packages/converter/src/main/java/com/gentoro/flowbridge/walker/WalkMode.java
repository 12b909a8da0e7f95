package com.gentoro.flowbridge.walker;

/** What the walker does with each expression it finds. */
public enum WalkMode {
  /** Rewrite expressions into the target dialect. */
  TRANSLATE,
  /** Reduce expressions to concrete values, falling back to the translated form. */
  EVALUATE
}
