package com.flamingo.ai.runbookflow.service.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.agent.dto.GraphGenerationResult;
import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.exception.MalformedGraphException;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.service.graph.DecisionGraphMapper;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link GraphSynthesisService} using the graph synthesis agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphSynthesisServiceImpl implements GraphSynthesisService {

  private final OracleClient oracleClient;
  private final DecisionGraphMapper mapper;
  private final ObjectMapper objectMapper;
  private final PipelineConfig pipelineConfig;

  @Override
  @Timed(value = "pipeline.synthesis", description = "Time to synthesize the decision graph")
  public StageOutcome<SynthesizedGraph> synthesize(String sourceText, ConceptGraph conceptGraph) {
    try {
      String concepts = objectMapper.writeValueAsString(conceptGraph);
      String content =
          SourceExcerpt.truncate(sourceText, pipelineConfig.getSynthesis().getMaxSourceChars());
      log.debug(
          "Synthesizing graph from {} chars of concepts and {} chars of source",
          concepts.length(),
          content.length());

      GraphGenerationResult result = oracleClient.synthesizeGraph(concepts, content);
      DecisionGraph graph = mapper.toDecisionGraph(result.flowchart());

      log.info(
          "Synthesized graph with {} nodes, {} edges, {} runbooks",
          graph.getNodes().size(),
          graph.getEdges().size(),
          graph.getRunbooks().size());
      return StageOutcome.ok(new SynthesizedGraph(graph, result.reasoning()));

    } catch (OracleCallException | MalformedGraphException e) {
      log.error("Graph synthesis failed: {}", e.getMessage());
      return StageOutcome.fatal(e);
    } catch (JsonProcessingException e) {
      log.error("Could not serialize concept graph: {}", e.getMessage());
      return StageOutcome.fatal(
          new OracleCallException("generating the flowchart", e.getMessage(), e));
    }
  }
}
