package com.flamingo.ai.runbookflow.service.pipeline;

import com.flamingo.ai.runbookflow.api.dto.response.AnalysisProgressEvent;
import com.flamingo.ai.runbookflow.domain.enums.ProgressStage;
import lombok.extern.slf4j.Slf4j;

/**
 * Emits the events of one run to a {@link ProgressSink}.
 *
 * <p>Percent is clamped to 0-100 and never goes down. At most one terminal event (complete or
 * error) is emitted and nothing after it; nothing at all is emitted once the sink is cancelled.
 * One instance per run, not thread-safe.
 */
@Slf4j
public class ProgressEmitter {

  private final ProgressSink sink;
  private int percent;
  private boolean terminated;

  public ProgressEmitter(ProgressSink sink) {
    this.sink = sink;
  }

  public void progress(ProgressStage stage, String message, int percent) {
    progress(stage, message, null, percent);
  }

  public void progress(ProgressStage stage, String message, String detail, int percent) {
    if (!canEmit()) {
      return;
    }
    int clamped = Math.max(0, Math.min(100, percent));
    if (clamped < this.percent) {
      log.debug("Holding percent at {} instead of {}", this.percent, clamped);
      clamped = this.percent;
    }
    this.percent = clamped;
    sink.emit(AnalysisProgressEvent.progress(stage, message, detail, clamped));
  }

  public void complete(AnalysisResult result) {
    if (!canEmit()) {
      return;
    }
    terminated = true;
    percent = 100;
    sink.emit(AnalysisProgressEvent.complete(result));
  }

  public void error(String errorId, String message) {
    if (!canEmit()) {
      return;
    }
    terminated = true;
    sink.emit(AnalysisProgressEvent.error(errorId, message));
  }

  public boolean isCancelled() {
    return sink.isCancelled();
  }

  public boolean isTerminated() {
    return terminated;
  }

  public int getPercent() {
    return percent;
  }

  private boolean canEmit() {
    return !terminated && !sink.isCancelled();
  }
}
