package com.flamingo.ai.runbookflow.agent.dto;

/** Flowchart metadata as emitted by the oracle. */
public record MetadataPayload(String title, String description, String version) {}
