package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** One ordered step of a runbook. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunbookStep(
    int order, String instruction, String details, String warning, List<String> toolsRequired) {}
