package com.flamingo.ai.runbookflow.agent.dto;

import java.util.List;

/** Structured output from GraphCritiqueAgent. */
public record CritiqueResult(
    Integer score, // 1-10
    List<CritiqueIssuePayload> issues,
    Boolean passesReview,
    String summary) {}
