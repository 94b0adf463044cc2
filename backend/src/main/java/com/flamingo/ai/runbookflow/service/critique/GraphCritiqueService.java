package com.flamingo.ai.runbookflow.service.critique;

import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;

/** Reviews a decision graph for structural defects. */
public interface GraphCritiqueService {

  /**
   * Critiques the graph with one oracle call plus deterministic structure checks.
   *
   * @return {@code OK} with the report, or {@code FALLBACK} with a neutral report when the oracle
   *     call fails
   */
  StageOutcome<CritiqueReport> critique(DecisionGraph graph, String sourceText);
}
