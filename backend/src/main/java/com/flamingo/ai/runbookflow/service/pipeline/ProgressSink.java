package com.flamingo.ai.runbookflow.service.pipeline;

import com.flamingo.ai.runbookflow.api.dto.response.AnalysisProgressEvent;

/** Consumer of a run's events, typically bridged to an SSE stream. */
public interface ProgressSink {

  /** Sink that drops every event and is never cancelled. */
  ProgressSink NONE =
      new ProgressSink() {
        @Override
        public void emit(AnalysisProgressEvent event) {}

        @Override
        public boolean isCancelled() {
          return false;
        }
      };

  void emit(AnalysisProgressEvent event);

  /** True once the consumer went away. The run stops at its next state boundary. */
  boolean isCancelled();
}
