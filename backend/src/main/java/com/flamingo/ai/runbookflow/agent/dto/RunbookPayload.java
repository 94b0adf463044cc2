package com.flamingo.ai.runbookflow.agent.dto;

import com.flamingo.ai.runbookflow.domain.model.SourceReference;
import java.util.List;

/** Runbook as emitted by the oracle. */
public record RunbookPayload(
    String id,
    String title,
    String description,
    List<RunbookStepPayload> steps,
    List<String> prerequisites,
    List<String> notes,
    List<String> relatedRunbookIds,
    SourceReference sourceRef) {}
