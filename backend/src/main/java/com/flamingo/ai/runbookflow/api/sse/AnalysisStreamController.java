package com.flamingo.ai.runbookflow.api.sse;

import com.flamingo.ai.runbookflow.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.runbookflow.api.dto.response.AnalysisProgressEvent;
import com.flamingo.ai.runbookflow.service.analysis.AnalysisService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller streaming runbook analysis progress with Server-Sent Events. */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisStreamController {

  private final AnalysisService analysisService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams analysis events: progress events, then one complete or error event.
   *
   * @param request the runbook to analyze
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<AnalysisProgressEvent> streamAnalysis(@Valid @RequestBody AnalyzeRequest request) {

    log.info("Starting analysis stream ({} chars)", request.getMarkdown().length());
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return analysisService
        .analyzeStream(request.getMarkdown())
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Analysis stream completed");
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Analysis stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Analysis stream cancelled by client");
            });
  }
}
