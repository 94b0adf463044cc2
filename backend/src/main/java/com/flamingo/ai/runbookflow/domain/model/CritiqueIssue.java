package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.runbookflow.domain.enums.IssueType;

/**
 * One structural defect found by the critic.
 *
 * @param type issue type from the fixed taxonomy
 * @param nodeId affected node, may be null
 * @param description what is wrong
 * @param suggestion how to fix it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CritiqueIssue(IssueType type, String nodeId, String description, String suggestion) {}
