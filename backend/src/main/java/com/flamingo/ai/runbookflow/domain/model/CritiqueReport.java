package com.flamingo.ai.runbookflow.domain.model;

import java.util.List;

/**
 * Result of reviewing a decision graph.
 *
 * @param score ordinal quality score, 1 to 10
 * @param issues defects found
 * @param passesReview whether the graph can be used without refinement
 * @param summary one-paragraph review summary
 */
public record CritiqueReport(
    int score, List<CritiqueIssue> issues, boolean passesReview, String summary) {

  public static final int NEUTRAL_SCORE = 5;

  public CritiqueReport {
    issues = issues != null ? List.copyOf(issues) : List.of();
  }

  /** Report used when the critic could not produce one. */
  public static CritiqueReport neutral(String reason) {
    return new CritiqueReport(NEUTRAL_SCORE, List.of(), false, reason);
  }

  public boolean hasBlockingIssues() {
    return issues.stream().anyMatch(issue -> issue.type().isBlocking());
  }
}
