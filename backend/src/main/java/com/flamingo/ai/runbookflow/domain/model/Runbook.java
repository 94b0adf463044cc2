package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A linear, branch-free procedure reachable from a runbook node.
 *
 * @param id runbook id referenced by {@link FlowNode#getRunbookId()}
 * @param title short title
 * @param description when to use the runbook
 * @param steps ordered steps
 * @param prerequisites required access or tools, may be null
 * @param notes free-form notes, may be null
 * @param relatedRunbookIds ids of related runbooks, may be null
 * @param sourceRef source text the runbook was derived from, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Runbook(
    String id,
    String title,
    String description,
    List<RunbookStep> steps,
    List<String> prerequisites,
    List<String> notes,
    List<String> relatedRunbookIds,
    SourceReference sourceRef) {

  public Runbook {
    steps = steps != null ? List.copyOf(steps) : List.of();
  }
}
