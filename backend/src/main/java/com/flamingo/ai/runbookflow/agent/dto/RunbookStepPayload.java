package com.flamingo.ai.runbookflow.agent.dto;

import java.util.List;

/** Runbook step as emitted by the oracle. */
public record RunbookStepPayload(
    Integer order,
    String instruction,
    String details,
    String warning,
    List<String> toolsRequired) {}
