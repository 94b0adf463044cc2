package com.flamingo.ai.runbookflow.agent.dto;

/** Edge as emitted by the oracle. */
public record EdgePayload(String id, String source, String target, String label, String type) {}
