package com.flamingo.ai.runbookflow.service.analysis;

import com.flamingo.ai.runbookflow.api.dto.response.AnalysisProgressEvent;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisPipeline;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisResult;
import com.flamingo.ai.runbookflow.service.pipeline.PipelineState;
import com.flamingo.ai.runbookflow.service.pipeline.ProgressEmitter;
import com.flamingo.ai.runbookflow.service.pipeline.ProgressSink;
import io.micrometer.core.annotation.Timed;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * Implementation of {@link AnalysisService}.
 *
 * <p>Each subscription runs one pipeline on the pipeline executor. Events are bridged into the
 * {@link Flux} through a {@link FluxSink}; cancelling the subscription flags the run and
 * interrupts its worker thread.
 */
@Service
@Slf4j
public class AnalysisServiceImpl implements AnalysisService {

  private final AnalysisPipeline pipeline;
  private final Executor pipelineExecutor;

  public AnalysisServiceImpl(
      AnalysisPipeline pipeline, @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
    this.pipeline = pipeline;
    this.pipelineExecutor = pipelineExecutor;
  }

  @Override
  public Flux<AnalysisProgressEvent> analyzeStream(String markdown) {
    return Flux.create(
        sink -> {
          String runId = UUID.randomUUID().toString().substring(0, 8);
          AtomicBoolean cancelled = new AtomicBoolean(false);
          ProgressSink progressSink = new FluxProgressSink(sink, cancelled);

          FutureTask<PipelineState> task =
              new FutureTask<>(
                  () -> {
                    try {
                      log.info("Starting analysis {} ({} chars)", runId, length(markdown));
                      PipelineState state = pipeline.run(markdown, progressSink);
                      log.info("Analysis {} finished: {}", runId, state);
                      return state;
                    } finally {
                      if (!cancelled.get()) {
                        sink.complete();
                      }
                    }
                  });

          sink.onCancel(
              () -> {
                if (cancelled.compareAndSet(false, true)) {
                  log.info("Analysis {} cancelled by subscriber", runId);
                  task.cancel(true);
                }
              });

          try {
            pipelineExecutor.execute(task);
          } catch (RejectedExecutionException e) {
            log.warn("Analysis {} rejected, executor saturated: {}", runId, e.getMessage());
            sink.next(
                AnalysisProgressEvent.error(
                    runId, "The service is busy. Please try again in a moment."));
            sink.complete();
          }
        });
  }

  @Override
  @Timed(value = "analysis.blocking", description = "Time to analyze a runbook synchronously")
  public AnalysisResult analyze(String markdown) {
    log.info("Starting blocking analysis ({} chars)", length(markdown));
    return pipeline.execute(markdown, new ProgressEmitter(ProgressSink.NONE));
  }

  private static int length(String markdown) {
    return markdown != null ? markdown.length() : 0;
  }

  /** Forwards events to the Flux until the subscriber cancels. */
  private static final class FluxProgressSink implements ProgressSink {

    private final FluxSink<AnalysisProgressEvent> sink;
    private final AtomicBoolean cancelled;

    private FluxProgressSink(FluxSink<AnalysisProgressEvent> sink, AtomicBoolean cancelled) {
      this.sink = sink;
      this.cancelled = cancelled;
    }

    @Override
    public void emit(AnalysisProgressEvent event) {
      if (!cancelled.get()) {
        sink.next(event);
      }
    }

    @Override
    public boolean isCancelled() {
      return cancelled.get() || sink.isCancelled();
    }
  }
}
