package com.flamingo.ai.runbookflow.service.pipeline;

import static com.flamingo.ai.runbookflow.fixtures.GraphFixtures.triageGraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.api.dto.response.AnalysisProgressEvent;
import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.enums.IssueType;
import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.domain.model.CritiqueIssue;
import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.exception.ContentTooLargeException;
import com.flamingo.ai.runbookflow.exception.InvalidDocumentException;
import com.flamingo.ai.runbookflow.exception.MalformedGraphException;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.service.chunking.HeadingAwareChunker;
import com.flamingo.ai.runbookflow.service.concept.ConceptExtractionService;
import com.flamingo.ai.runbookflow.service.concept.ConceptGraphMerger;
import com.flamingo.ai.runbookflow.service.critique.GraphCritiqueService;
import com.flamingo.ai.runbookflow.service.graph.DecisionGraphMapper;
import com.flamingo.ai.runbookflow.service.graph.GraphLayoutService;
import com.flamingo.ai.runbookflow.service.graph.LabelNormalizer;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import com.flamingo.ai.runbookflow.service.refinement.GraphRefinementServiceImpl;
import com.flamingo.ai.runbookflow.service.synthesis.GraphSynthesisService;
import com.flamingo.ai.runbookflow.service.synthesis.SynthesizedGraph;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnalysisPipelineTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  /** Plain paragraphs, no headings, well under one chunk. */
  private static final String RUNBOOK =
      "When a user cannot log in, first check whether MFA is enabled on the account. ".repeat(26);

  @Mock private ConceptExtractionService extractionService;
  @Mock private GraphSynthesisService synthesisService;
  @Mock private GraphCritiqueService critiqueService;
  @Mock private OracleClient oracleClient;

  private PipelineConfig config;
  private SimpleMeterRegistry meterRegistry;
  private AnalysisPipeline pipeline;
  private RecordingSink sink;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    meterRegistry = new SimpleMeterRegistry();
    ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    pipeline =
        new AnalysisPipeline(
            new HeadingAwareChunker(config),
            extractionService,
            new ConceptGraphMerger(),
            synthesisService,
            critiqueService,
            new GraphRefinementServiceImpl(
                oracleClient, new DecisionGraphMapper(), objectMapper, config),
            new LabelNormalizer(),
            new GraphLayoutService(config),
            config,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
    sink = new RecordingSink();
  }

  private void givenSynthesisSucceeds() {
    when(extractionService.extract(any(Chunk.class), anyInt())).thenReturn(ConceptGraph.empty());
    when(synthesisService.synthesize(anyString(), any(ConceptGraph.class)))
        .thenReturn(StageOutcome.ok(new SynthesizedGraph(triageGraph(), "Split by MFA state")));
  }

  private void givenCritique(CritiqueReport report) {
    when(critiqueService.critique(any(DecisionGraph.class), anyString()))
        .thenReturn(StageOutcome.ok(report));
  }

  private static CallNotPermittedException openBreaker() {
    return CallNotPermittedException.createCallNotPermittedException(
        CircuitBreaker.ofDefaults("oracle"));
  }

  private AnalysisProgressEvent lastEvent() {
    return sink.events.get(sink.events.size() - 1);
  }

  @Nested
  @DisplayName("Successful runs")
  class SuccessfulRuns {

    @Test
    @DisplayName("should complete without refinement when the critique passes")
    void shouldComplete_whenCritiquePasses() {
      givenSynthesisSucceeds();
      givenCritique(new CritiqueReport(9, List.of(), true, "Looks good"));

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.DONE);
      verify(extractionService, times(1)).extract(any(Chunk.class), eq(1));
      verify(oracleClient, never()).refineGraph(anyString(), anyString(), anyString());

      AnalysisProgressEvent complete = lastEvent();
      assertThat(complete.getType()).isEqualTo(AnalysisProgressEvent.COMPLETE);
      assertThat(complete.getSummary().chunkCount()).isEqualTo(1);
      assertThat(complete.getSummary().refined()).isFalse();
      assertThat(complete.getReasoning()).isEqualTo("Split by MFA state");
      assertThat(complete.getMetadata().generatedAt()).isEqualTo(NOW);
      assertThat(complete.getMetadata().originalMarkdown()).isEqualTo(RUNBOOK);
      for (FlowNode node : complete.getNodes()) {
        if (node.getKind() == NodeKind.START) {
          assertThat(node.getDepth()).isZero();
        } else {
          assertThat(node.getDepth()).isGreaterThanOrEqualTo(1);
        }
      }
      assertThat(complete.getNodes())
          .filteredOn(node -> node.getId().equals("q1"))
          .extracting(FlowNode::getLabel)
          .containsExactly("Is this an MFA issue?");
    }

    @Test
    @DisplayName("should report monotonically increasing percent ending at 100")
    void shouldReportMonotonicPercent() {
      givenSynthesisSucceeds();
      givenCritique(new CritiqueReport(9, List.of(), true, ""));

      pipeline.run(RUNBOOK, sink);

      List<Integer> percents =
          sink.events.stream()
              .map(AnalysisProgressEvent::getPercent)
              .filter(Objects::nonNull)
              .toList();
      assertThat(percents).isSorted().startsWith(5, 10).endsWith(100);
      assertThat(sink.events).filteredOn(AnalysisProgressEvent::isTerminal).hasSize(1);
    }

    @Test
    @DisplayName("should keep the first graph when the single refinement attempt fails")
    void shouldKeepFirstGraph_whenRefinementFails() {
      givenSynthesisSucceeds();
      CritiqueIssue merged =
          new CritiqueIssue(IssueType.MERGED_PATHS, "q1", "Branches share a runbook", "Split");
      givenCritique(new CritiqueReport(6, List.of(merged), false, "Needs work"));
      when(oracleClient.refineGraph(anyString(), anyString(), anyString()))
          .thenThrow(new OracleCallException("refining the flowchart", "timeout", null));

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.DONE);
      verify(oracleClient, times(1)).refineGraph(anyString(), anyString(), anyString());
      AnalysisProgressEvent complete = lastEvent();
      assertThat(complete.getType()).isEqualTo(AnalysisProgressEvent.COMPLETE);
      assertThat(complete.getNodes())
          .extracting(FlowNode::getId)
          .containsExactly("start", "q1", "a-yes", "a-no", "rb-node", "end-ok", "end-esc");
      assertThat(complete.getSummary().refined()).isFalse();
      assertThat(complete.getSummary().critiqueScore()).isEqualTo(6);
      assertThat(complete.getSummary().warnings())
          .anySatisfy(warning -> assertThat(warning).startsWith("Refinement failed"));
      assertThat(
              meterRegistry.counter("pipeline.fallbacks", "stage", "refinement").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip a failed chunk and still synthesize")
    void shouldSkipChunk_whenExtractionFails() {
      when(extractionService.extract(any(Chunk.class), anyInt()))
          .thenThrow(new OracleCallException("extracting concepts", "boom", null));
      when(synthesisService.synthesize(anyString(), any(ConceptGraph.class)))
          .thenReturn(StageOutcome.ok(new SynthesizedGraph(triageGraph(), "")));
      givenCritique(new CritiqueReport(9, List.of(), true, ""));

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.DONE);
      assertThat(lastEvent().getSummary().warnings())
          .containsExactly("Concept extraction failed for section 1");
    }

    @Test
    @DisplayName("should skip a chunk rejected by the open circuit breaker")
    void shouldSkipChunk_whenBreakerRejectsExtraction() {
      when(extractionService.extract(any(Chunk.class), anyInt())).thenThrow(openBreaker());
      when(synthesisService.synthesize(anyString(), any(ConceptGraph.class)))
          .thenReturn(StageOutcome.ok(new SynthesizedGraph(triageGraph(), "")));
      givenCritique(new CritiqueReport(9, List.of(), true, ""));

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.DONE);
      assertThat(lastEvent().getType()).isEqualTo(AnalysisProgressEvent.COMPLETE);
      assertThat(lastEvent().getSummary().warnings())
          .containsExactly("Concept extraction failed for section 1");
      assertThat(
              meterRegistry.counter("pipeline.fallbacks", "stage", "extraction").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep the first graph when the open circuit breaker rejects refinement")
    void shouldKeepFirstGraph_whenBreakerRejectsRefinement() {
      givenSynthesisSucceeds();
      CritiqueIssue merged =
          new CritiqueIssue(IssueType.MERGED_PATHS, "q1", "Branches share a runbook", "Split");
      givenCritique(new CritiqueReport(6, List.of(merged), false, "Needs work"));
      when(oracleClient.refineGraph(anyString(), anyString(), anyString()))
          .thenThrow(openBreaker());

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.DONE);
      assertThat(lastEvent().getType()).isEqualTo(AnalysisProgressEvent.COMPLETE);
      assertThat(lastEvent().getSummary().refined()).isFalse();
      assertThat(lastEvent().getSummary().warnings())
          .anySatisfy(warning -> assertThat(warning).startsWith("Refinement failed"));
    }
  }

  @Nested
  @DisplayName("Failed runs")
  class FailedRuns {

    @Test
    @DisplayName("should emit a single error event when synthesis fails")
    void shouldEmitError_whenSynthesisFatal() {
      when(extractionService.extract(any(Chunk.class), anyInt())).thenReturn(ConceptGraph.empty());
      when(synthesisService.synthesize(anyString(), any(ConceptGraph.class)))
          .thenReturn(StageOutcome.fatal(new MalformedGraphException("no nodes")));

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.FAILED);
      assertThat(sink.events).filteredOn(AnalysisProgressEvent::isTerminal).hasSize(1);
      assertThat(lastEvent().getType()).isEqualTo(AnalysisProgressEvent.ERROR);
      assertThat(lastEvent().getErrorId()).hasSize(8);
      verifyNoInteractions(critiqueService);
      assertThat(meterRegistry.counter("pipeline.failures").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject an oversized document before any oracle call")
    void shouldRejectOversized_beforeOracleCalls() {
      config.getChunking().setMaxTokensPerChunk(100);
      config.getChunking().setMaxChunks(2);

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.FAILED);
      assertThat(lastEvent().getMessage()).contains("too large");
      verifyNoInteractions(extractionService, synthesisService, critiqueService, oracleClient);
    }

    @Test
    @DisplayName("should throw for a document below the minimum length")
    void shouldThrow_whenDocumentTooShort() {
      assertThatThrownBy(
              () -> pipeline.execute("too short", new ProgressEmitter(ProgressSink.NONE)))
          .isInstanceOf(InvalidDocumentException.class)
          .hasMessageContaining("at least 50");
    }

    @Test
    @DisplayName("should stop silently when the consumer cancels")
    void shouldStopSilently_whenCancelled() {
      sink.cancelAfter = 1;

      PipelineState state = pipeline.run(RUNBOOK, sink);

      assertThat(state).isEqualTo(PipelineState.CANCELLED);
      assertThat(sink.events).hasSize(1);
      assertThat(sink.events).noneMatch(AnalysisProgressEvent::isTerminal);
      verifyNoInteractions(extractionService, synthesisService);
      assertThat(meterRegistry.counter("pipeline.cancellations").count()).isEqualTo(1.0);
    }
  }

  /** Records events and reports cancellation once {@code cancelAfter} events were seen. */
  private static class RecordingSink implements ProgressSink {

    private final List<AnalysisProgressEvent> events = new ArrayList<>();
    private int cancelAfter = Integer.MAX_VALUE;

    @Override
    public void emit(AnalysisProgressEvent event) {
      events.add(event);
    }

    @Override
    public boolean isCancelled() {
      return events.size() >= cancelAfter;
    }
  }
}
