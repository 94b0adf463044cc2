package com.flamingo.ai.runbookflow.agent;

import com.flamingo.ai.runbookflow.agent.dto.CritiqueResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that reviews a generated decision graph against its source runbook. */
public interface GraphCritiqueAgent {

  @SystemMessage(
      """
        You are a strict reviewer of support decision trees. Review the flowchart against the
        runbook it was generated from and return a JSON object:

        {"score": 1-10, "passesReview": true|false, "summary": "...",
         "issues": [{"type": "...", "nodeId": "...", "description": "...", "suggestion": "..."}]}

        Allowed issue types (use exactly these strings):
        - "merged_paths": branches of a categorical split lead into a shared node.
        - "disconnected_node": a node is unreachable, or a non-terminal node has no exit.
        - "collapsed_procedure": several distinct procedures were squashed into one node/runbook.
        - "missing_why": a question lacks a source reference explaining why it is asked.
        - "unseparated_prerequisite": a prerequisite check is buried inside a runbook instead of
          being a question.
        - "shallow_runbook": a runbook is too vague to execute.
        - "complex_runbook": a runbook contains branching that belongs in the tree.

        A graph with any merged_paths or disconnected_node issue never passes review.
        Set "nodeId" to the affected node id when there is one. Return ONLY valid JSON.
        """)
  @UserMessage(
      """
        ## FLOWCHART

        {{graph}}

        ## RUNBOOK

        {{content}}
        """)
  CritiqueResult critique(@V("graph") String graph, @V("content") String content);
}
