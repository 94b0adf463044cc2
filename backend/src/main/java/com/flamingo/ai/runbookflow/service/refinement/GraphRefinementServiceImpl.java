package com.flamingo.ai.runbookflow.service.refinement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.agent.dto.GraphGenerationResult;
import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.service.graph.DecisionGraphMapper;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;
import com.flamingo.ai.runbookflow.service.synthesis.SourceExcerpt;
import com.flamingo.ai.runbookflow.service.synthesis.SynthesizedGraph;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link GraphRefinementService} using the graph refinement agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphRefinementServiceImpl implements GraphRefinementService {

  private final OracleClient oracleClient;
  private final DecisionGraphMapper mapper;
  private final ObjectMapper objectMapper;
  private final PipelineConfig pipelineConfig;

  @Override
  public boolean shouldRefine(CritiqueReport report) {
    PipelineConfig.Refinement config = pipelineConfig.getRefinement();
    return config.isEnabled()
        && !report.passesReview()
        && report.score() < config.getScoreThreshold()
        && !report.issues().isEmpty();
  }

  @Override
  @Timed(value = "pipeline.refinement", description = "Time to refine the decision graph")
  public StageOutcome<SynthesizedGraph> refine(
      SynthesizedGraph previous, CritiqueReport report, String sourceText) {
    try {
      String graphJson = objectMapper.writeValueAsString(previous.graph().snapshot());
      String critiqueJson = objectMapper.writeValueAsString(report);
      String content =
          SourceExcerpt.truncate(sourceText, pipelineConfig.getSynthesis().getMaxSourceChars());

      GraphGenerationResult result = oracleClient.refineGraph(graphJson, critiqueJson, content);
      DecisionGraph refined = mapper.toDecisionGraph(result.flowchart());
      if (result.flowchart().metadata() == null) {
        // Keep the title the first pass chose
        refined.setMetadata(previous.graph().getMetadata());
      }

      log.info(
          "Refined graph: {} -> {} nodes, fixing {} issues",
          previous.graph().getNodes().size(),
          refined.getNodes().size(),
          report.issues().size());
      return StageOutcome.ok(new SynthesizedGraph(refined, result.reasoning()));

    } catch (Exception e) {
      log.warn("Refinement failed, keeping the previous graph: {}", e.getMessage());
      return StageOutcome.fallback(previous, "Refinement failed: " + e.getMessage());
    }
  }
}
