package com.flamingo.ai.runbookflow.agent.dto;

/** Critique issue as emitted by the oracle. */
public record CritiqueIssuePayload(
    String type, String nodeId, String description, String suggestion) {}
