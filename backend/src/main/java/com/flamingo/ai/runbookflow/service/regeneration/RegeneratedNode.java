package com.flamingo.ai.runbookflow.service.regeneration;

import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.Runbook;

/**
 * A rewritten node.
 *
 * @param node the new node
 * @param runbook replacement runbook, null unless the node is a runbook node and one was returned
 */
public record RegeneratedNode(FlowNode node, Runbook runbook) {}
