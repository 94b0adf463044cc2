package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.runbookflow.domain.enums.EdgeStyle;

/**
 * Directed edge between two nodes.
 *
 * @param id edge id, unique within the graph
 * @param source id of the source node
 * @param target id of the target node
 * @param label branch label such as "Yes" or a condition, may be null
 * @param type rendering hint
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowEdge(String id, String source, String target, String label, EdgeStyle type) {}
