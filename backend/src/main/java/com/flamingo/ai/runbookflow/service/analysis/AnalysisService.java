package com.flamingo.ai.runbookflow.service.analysis;

import com.flamingo.ai.runbookflow.api.dto.response.AnalysisProgressEvent;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisResult;
import reactor.core.publisher.Flux;

/** Service turning runbook text into a decision graph. */
public interface AnalysisService {

  /**
   * Analyzes a runbook, streaming progress events.
   *
   * <p>The stream ends with exactly one complete or error event. Cancelling the subscription stops
   * the run and interrupts the in-flight oracle call.
   *
   * @param markdown the runbook text
   * @return a Flux of analysis events
   */
  Flux<AnalysisProgressEvent> analyzeStream(String markdown);

  /**
   * Analyzes a runbook and blocks until done.
   *
   * @param markdown the runbook text
   * @return the final result
   */
  AnalysisResult analyze(String markdown);
}
