package com.flamingo.ai.runbookflow.service.pipeline;

import com.flamingo.ai.runbookflow.domain.model.CritiqueIssue;
import java.util.List;

/**
 * Run summary delivered with the final graph.
 *
 * @param chunkCount number of chunks the document was split into
 * @param critiqueScore score of the critique that gated refinement
 * @param passesReview whether that critique passed
 * @param refined whether a refined graph replaced the first one
 * @param issues issues of that critique
 * @param warnings degraded paths taken during the run (skipped chunks, fallbacks)
 */
public record AnalysisSummary(
    int chunkCount,
    int critiqueScore,
    boolean passesReview,
    boolean refined,
    List<CritiqueIssue> issues,
    List<String> warnings) {

  public AnalysisSummary {
    issues = issues != null ? List.copyOf(issues) : List.of();
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }
}
