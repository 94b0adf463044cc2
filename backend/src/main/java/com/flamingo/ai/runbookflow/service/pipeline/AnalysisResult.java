package com.flamingo.ai.runbookflow.service.pipeline;

import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;

/**
 * Final output of a pipeline run.
 *
 * @param graph immutable snapshot of the laid-out graph
 * @param reasoning the oracle's explanation of the final graph, may be null
 * @param summary run summary
 */
public record AnalysisResult(DecisionGraph graph, String reasoning, AnalysisSummary summary) {}
