package com.flamingo.ai.runbookflow.service.concept;

import com.flamingo.ai.runbookflow.agent.dto.ExtractedConcepts;
import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link ConceptExtractionService} using the concept extraction agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConceptExtractionServiceImpl implements ConceptExtractionService {

  private final OracleClient oracleClient;
  private final ConceptGraphMerger merger;

  @Override
  @Timed(value = "pipeline.concept_extraction", description = "Time to extract concepts of a chunk")
  public ConceptGraph extract(Chunk chunk, int chunkCount) {
    log.debug(
        "Extracting concepts from chunk {}/{} (~{} tokens)",
        chunk.index() + 1,
        chunkCount,
        chunk.estimatedTokens());

    ExtractedConcepts result =
        oracleClient.extractConcepts(chunk.index() + 1, chunkCount, chunk.text());

    ConceptGraph raw =
        new ConceptGraph(
            result.principles(),
            result.userTypes(),
            result.issueCategories(),
            result.procedures(),
            result.decisionPoints(),
            result.conceptOrder());

    // Same dedup rules within a chunk as across chunks
    ConceptGraph graph = merger.merge(List.of(raw));
    log.debug(
        "Chunk {}: {} procedures, {} decision points",
        chunk.index() + 1,
        graph.procedures().size(),
        graph.decisionPoints().size());
    return graph;
  }
}
