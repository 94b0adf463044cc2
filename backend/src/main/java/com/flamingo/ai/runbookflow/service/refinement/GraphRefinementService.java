package com.flamingo.ai.runbookflow.service.refinement;

import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;
import com.flamingo.ai.runbookflow.service.synthesis.SynthesizedGraph;

/** Applies critique feedback to a decision graph in a single corrective pass. */
public interface GraphRefinementService {

  /**
   * Whether a critique warrants refinement: review failed, the score is under the threshold and
   * there is at least one issue to fix.
   */
  boolean shouldRefine(CritiqueReport report);

  /**
   * Makes exactly one refinement call.
   *
   * @return {@code OK} with the refined graph, or {@code FALLBACK} with {@code previous} when the
   *     oracle fails or returns an empty or malformed graph
   */
  StageOutcome<SynthesizedGraph> refine(
      SynthesizedGraph previous, CritiqueReport report, String sourceText);
}
