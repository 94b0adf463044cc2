package com.flamingo.ai.runbookflow.agent.dto;

import com.flamingo.ai.runbookflow.domain.model.SourceReference;

/** Node as emitted by the oracle. Kinds and end states are still raw strings here. */
public record NodePayload(
    String id,
    String type, // start | question | answer | runbook | end
    String label,
    String description,
    String question,
    SourceReference sourceRef,
    String runbookId,
    String endStateType // resolved | escalate | manual | blocked
    ) {}
