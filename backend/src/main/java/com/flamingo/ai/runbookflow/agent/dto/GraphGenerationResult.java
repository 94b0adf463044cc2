package com.flamingo.ai.runbookflow.agent.dto;

/**
 * Structured output from GraphSynthesisAgent and GraphRefinementAgent.
 *
 * @param reasoning how the oracle decomposed the runbook, or which critique issues it fixed
 * @param flowchart the generated graph
 */
public record GraphGenerationResult(String reasoning, GraphPayload flowchart) {}
