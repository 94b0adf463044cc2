package com.flamingo.ai.runbookflow.service.synthesis;

import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;

/** Generates the initial decision graph from the merged concept graph. */
public interface GraphSynthesisService {

  /**
   * Makes one oracle call and validates the returned graph.
   *
   * @param sourceText the original document
   * @param conceptGraph merged concepts of all chunks
   * @return {@code OK} with the graph, or {@code FATAL} when the oracle fails or the graph is empty
   *     or malformed
   */
  StageOutcome<SynthesizedGraph> synthesize(String sourceText, ConceptGraph conceptGraph);
}
