package com.flamingo.ai.runbookflow.api.rest;

import static com.flamingo.ai.runbookflow.fixtures.GraphFixtures.runbook;
import static com.flamingo.ai.runbookflow.fixtures.GraphFixtures.triageGraph;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.api.dto.request.EnrichRunbooksRequest;
import com.flamingo.ai.runbookflow.api.dto.request.RegenerateNodeRequest;
import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.enums.RegenerationMode;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.exception.ApiError;
import com.flamingo.ai.runbookflow.exception.ContentTooLargeException;
import com.flamingo.ai.runbookflow.exception.GlobalExceptionHandler;
import com.flamingo.ai.runbookflow.exception.InvalidDocumentException;
import com.flamingo.ai.runbookflow.exception.NodeNotFoundException;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.service.analysis.AnalysisService;
import com.flamingo.ai.runbookflow.service.enrichment.RunbookEnrichmentService;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisResult;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisSummary;
import com.flamingo.ai.runbookflow.service.regeneration.NodeRegenerationService;
import com.flamingo.ai.runbookflow.service.regeneration.RegeneratedNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("REST controller tests")
class RestControllersTest {

  private static final String MARKDOWN =
      "# Login support\n\nIf the user has MFA enabled, reset the factor. Otherwise escalate.";

  @Mock private AnalysisService analysisService;
  @Mock private RunbookEnrichmentService enrichmentService;
  @Mock private NodeRegenerationService regenerationService;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new AnalysisController(analysisService),
                new RunbookController(enrichmentService),
                new NodeController(regenerationService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper().findAndRegisterModules();
  }

  private String analyzeBody() throws Exception {
    return objectMapper.writeValueAsString(Map.of("markdown", MARKDOWN));
  }

  @Nested
  @DisplayName("POST /api/analysis")
  class Analyze {

    @Test
    @DisplayName("should return the laid-out graph with its summary")
    void shouldReturnGraph_whenAnalysisSucceeds() throws Exception {
      when(analysisService.analyze(MARKDOWN))
          .thenReturn(
              new AnalysisResult(
                  triageGraph(),
                  "Split by MFA state",
                  new AnalysisSummary(1, 9, true, false, null, null)));

      mockMvc
          .perform(
              post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(analyzeBody()))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.nodes.length()").value(7))
          .andExpect(jsonPath("$.edges.length()").value(6))
          .andExpect(jsonPath("$.runbooks[0].id").value("rb-1"))
          .andExpect(jsonPath("$.reasoning").value("Split by MFA state"))
          .andExpect(jsonPath("$.summary.critiqueScore").value(9));
    }

    @Test
    @DisplayName("should map a too-short document to 400")
    void shouldReturnBadRequest_whenDocumentInvalid() throws Exception {
      when(analysisService.analyze(anyString()))
          .thenThrow(new InvalidDocumentException("Runbook content is too short."));

      mockMvc
          .perform(
              post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(analyzeBody()))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.INVALID_DOCUMENT))
          .andExpect(jsonPath("$.errorId").exists());
    }

    @Test
    @DisplayName("should map an oversized document to 413")
    void shouldReturnPayloadTooLarge_whenTooManyChunks() throws Exception {
      when(analysisService.analyze(anyString())).thenThrow(new ContentTooLargeException(14, 10));

      mockMvc
          .perform(
              post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(analyzeBody()))
          .andExpect(status().isPayloadTooLarge())
          .andExpect(jsonPath("$.code").value(ApiError.CONTENT_TOO_LARGE));
    }

    @Test
    @DisplayName("should map a rate-limited oracle to 429")
    void shouldReturnTooManyRequests_whenRateLimited() throws Exception {
      when(analysisService.analyze(anyString()))
          .thenThrow(new OracleCallException("generating the flowchart", "429", null, true));

      mockMvc
          .perform(
              post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content(analyzeBody()))
          .andExpect(status().isTooManyRequests())
          .andExpect(jsonPath("$.code").value(ApiError.ORACLE_RATE_LIMITED));
    }
  }

  @Nested
  @DisplayName("POST /api/runbooks/enrich")
  class Enrich {

    @Test
    @DisplayName("should return the enriched runbooks")
    void shouldReturnRunbooks() throws Exception {
      when(enrichmentService.enrich(anyList())).thenReturn(List.of(runbook("rb-1", "Reset MFA")));
      EnrichRunbooksRequest request =
          EnrichRunbooksRequest.builder().runbooks(List.of(runbook("rb-1", "Reset MFA"))).build();

      mockMvc
          .perform(
              post("/api/runbooks/enrich")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.runbooks[0].id").value("rb-1"))
          .andExpect(jsonPath("$.runbooks[0].steps.length()").value(2));
    }

    @Test
    @DisplayName("should reject an empty runbook list")
    void shouldRejectEmptyList() throws Exception {
      mockMvc
          .perform(
              post("/api/runbooks/enrich")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"runbooks\":[]}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

      verifyNoInteractions(enrichmentService);
    }
  }

  @Nested
  @DisplayName("POST /api/nodes/{nodeId}/regenerate")
  class Regenerate {

    @Test
    @DisplayName("should default to regenerate mode")
    void shouldDefaultToRegenerateMode() throws Exception {
      FlowNode node =
          FlowNode.builder().id("q1").kind(NodeKind.QUESTION).label("Is MFA on?").build();
      when(regenerationService.regenerate(
              any(DecisionGraph.class), eq("q1"), isNull(), eq(RegenerationMode.REGENERATE)))
          .thenReturn(new RegeneratedNode(node, null));
      RegenerateNodeRequest request =
          RegenerateNodeRequest.builder().flowchart(triageGraph()).build();

      mockMvc
          .perform(
              post("/api/nodes/{nodeId}/regenerate", "q1")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.node.id").value("q1"))
          .andExpect(jsonPath("$.node.label").value("Is MFA on?"));

      verify(regenerationService)
          .regenerate(
              any(DecisionGraph.class), eq("q1"), isNull(), eq(RegenerationMode.REGENERATE));
    }

    @Test
    @DisplayName("should map an unknown node to 404")
    void shouldReturnNotFound_whenNodeUnknown() throws Exception {
      when(regenerationService.regenerate(any(DecisionGraph.class), eq("nope"), any(), any()))
          .thenThrow(new NodeNotFoundException("nope"));
      RegenerateNodeRequest request =
          RegenerateNodeRequest.builder()
              .flowchart(triageGraph())
              .mode(RegenerationMode.EXPAND)
              .build();

      mockMvc
          .perform(
              post("/api/nodes/{nodeId}/regenerate", "nope")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(objectMapper.writeValueAsString(request)))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value(ApiError.NODE_NOT_FOUND));
    }
  }
}
