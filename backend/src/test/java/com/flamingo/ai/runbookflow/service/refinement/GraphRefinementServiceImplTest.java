package com.flamingo.ai.runbookflow.service.refinement;

import static com.flamingo.ai.runbookflow.fixtures.GraphFixtures.triageGraph;
import static com.flamingo.ai.runbookflow.fixtures.GraphFixtures.triagePayload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.agent.dto.GraphGenerationResult;
import com.flamingo.ai.runbookflow.agent.dto.GraphPayload;
import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.enums.IssueType;
import com.flamingo.ai.runbookflow.domain.model.CritiqueIssue;
import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.service.graph.DecisionGraphMapper;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;
import com.flamingo.ai.runbookflow.service.synthesis.SynthesizedGraph;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GraphRefinementServiceImplTest {

  private static final CritiqueIssue MERGED =
      new CritiqueIssue(IssueType.MERGED_PATHS, "q1", "Branches reconverge", "Split them");

  @Mock private OracleClient oracleClient;

  private PipelineConfig config;
  private GraphRefinementServiceImpl service;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    service =
        new GraphRefinementServiceImpl(
            oracleClient,
            new DecisionGraphMapper(),
            new ObjectMapper().findAndRegisterModules(),
            config);
  }

  @Nested
  @DisplayName("shouldRefine")
  class ShouldRefine {

    @Test
    @DisplayName("should refine a failing, low-scoring report with issues")
    void shouldRefine_whenFailingLowScoreWithIssues() {
      assertThat(service.shouldRefine(new CritiqueReport(6, List.of(MERGED), false, "")))
          .isTrue();
    }

    @Test
    @DisplayName("should not refine a report that passes review")
    void shouldNotRefine_whenPassesReview() {
      assertThat(service.shouldRefine(new CritiqueReport(6, List.of(MERGED), true, "")))
          .isFalse();
    }

    @Test
    @DisplayName("should not refine at or above the score threshold")
    void shouldNotRefine_whenScoreAtThreshold() {
      assertThat(service.shouldRefine(new CritiqueReport(8, List.of(MERGED), false, "")))
          .isFalse();
    }

    @Test
    @DisplayName("should not refine without issues, such as the neutral report")
    void shouldNotRefine_whenNoIssues() {
      assertThat(service.shouldRefine(CritiqueReport.neutral("unavailable"))).isFalse();
    }

    @Test
    @DisplayName("should not refine when disabled")
    void shouldNotRefine_whenDisabled() {
      config.getRefinement().setEnabled(false);

      assertThat(service.shouldRefine(new CritiqueReport(3, List.of(MERGED), false, "")))
          .isFalse();
    }
  }

  @Test
  @DisplayName("should return the refined graph on success")
  void shouldReturnRefinedGraph_whenOracleSucceeds() {
    when(oracleClient.refineGraph(anyString(), anyString(), anyString()))
        .thenReturn(new GraphGenerationResult("Fixed merged paths", triagePayload()));
    SynthesizedGraph previous = new SynthesizedGraph(triageGraph(), "first");
    CritiqueReport report = new CritiqueReport(6, List.of(MERGED), false, "");

    StageOutcome<SynthesizedGraph> outcome = service.refine(previous, report, "text");

    assertThat(outcome.isOk()).isTrue();
    assertThat(outcome.value()).isNotSameAs(previous);
    assertThat(outcome.value().reasoning()).isEqualTo("Fixed merged paths");
    verify(oracleClient).refineGraph(anyString(), anyString(), anyString());
  }

  @Test
  @DisplayName("should keep the previous graph when the oracle fails")
  void shouldFallBack_whenOracleFails() {
    when(oracleClient.refineGraph(anyString(), anyString(), anyString()))
        .thenThrow(new OracleCallException("refining the flowchart", "boom", null));
    SynthesizedGraph previous = new SynthesizedGraph(triageGraph(), "first");

    StageOutcome<SynthesizedGraph> outcome =
        service.refine(previous, new CritiqueReport(6, List.of(MERGED), false, ""), "text");

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.value()).isSameAs(previous);
    assertThat(outcome.reason()).contains("boom");
  }

  @Test
  @DisplayName("should keep the previous graph when the refined graph is empty")
  void shouldFallBack_whenRefinedGraphEmpty() {
    when(oracleClient.refineGraph(anyString(), anyString(), anyString()))
        .thenReturn(new GraphGenerationResult("", new GraphPayload(null, null, null, null)));
    SynthesizedGraph previous = new SynthesizedGraph(triageGraph(), "first");

    StageOutcome<SynthesizedGraph> outcome =
        service.refine(previous, new CritiqueReport(6, List.of(MERGED), false, ""), "text");

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.value()).isSameAs(previous);
  }

  @Test
  @DisplayName("should keep the previous graph when the circuit breaker is open")
  void shouldFallBack_whenBreakerOpen() {
    when(oracleClient.refineGraph(anyString(), anyString(), anyString()))
        .thenThrow(
            CallNotPermittedException.createCallNotPermittedException(
                CircuitBreaker.ofDefaults("oracle")));
    SynthesizedGraph previous = new SynthesizedGraph(triageGraph(), "first");

    StageOutcome<SynthesizedGraph> outcome =
        service.refine(previous, new CritiqueReport(6, List.of(MERGED), false, ""), "text");

    assertThat(outcome.isFallback()).isTrue();
    assertThat(outcome.value()).isSameAs(previous);
    assertThat(outcome.reason()).startsWith("Refinement failed");
  }
}
