package com.flamingo.ai.runbookflow.service.regeneration;

import com.flamingo.ai.runbookflow.domain.enums.RegenerationMode;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;

/** Rewrites a single node of an existing decision graph. */
public interface NodeRegenerationService {

  /**
   * Regenerates one node with one oracle call. The node keeps its id, kind, position and depth.
   *
   * @param graph the graph the node belongs to, not modified
   * @param nodeId id of the node to rewrite
   * @param feedback optional user feedback
   * @param mode rewrite or expand
   * @return the new node and, for runbook nodes, the replacement runbook if one was produced
   * @throws com.flamingo.ai.runbookflow.exception.NodeNotFoundException if the id is unknown
   * @throws com.flamingo.ai.runbookflow.exception.OracleCallException if the oracle call fails
   */
  RegeneratedNode regenerate(
      DecisionGraph graph, String nodeId, String feedback, RegenerationMode mode);
}
