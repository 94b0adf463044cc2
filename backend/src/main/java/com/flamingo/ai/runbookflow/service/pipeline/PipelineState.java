package com.flamingo.ai.runbookflow.service.pipeline;

/** States of one analysis run. */
public enum PipelineState {
  CHUNKING,
  EXTRACTING,
  SYNTHESIZING,
  CRITIQUING,
  REFINING,
  NORMALIZING,
  LAYING_OUT,
  DONE,
  FAILED,
  CANCELLED
}
