package com.flamingo.ai.runbookflow.agent.dto;

import java.util.List;

/** Decision graph as emitted by the oracle, before validation. */
public record GraphPayload(
    List<NodePayload> nodes,
    List<EdgePayload> edges,
    List<RunbookPayload> runbooks,
    MetadataPayload metadata) {}
