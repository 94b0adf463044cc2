package com.flamingo.ai.runbookflow.agent;

import com.flamingo.ai.runbookflow.agent.dto.NodeRegenerationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that rewrites a single node of an existing flowchart. */
public interface NodeRegenerationAgent {

  @SystemMessage(
      """
        You rewrite one node of a support flowchart. Keep the node id and type unchanged.
        In "regenerate" mode improve wording and accuracy. In "expand" mode add detail: a fuller
        question text, a richer description and, for runbook nodes, more specific steps.
        Return JSON {"node": {...}, "runbook": {...}}. Include "runbook" only for runbook nodes,
        keeping its id. Return ONLY valid JSON.
        """)
  @UserMessage(
      """
        Mode: {{mode}}

        Flowchart: {{title}}
        {{description}}

        Node to rewrite:
        {{node}}

        Current runbook (runbook nodes only):
        {{runbook}}

        User feedback: {{feedback}}

        Relevant runbook excerpt:
        {{excerpt}}
        """)
  NodeRegenerationResult regenerate(
      @V("mode") String mode,
      @V("title") String title,
      @V("description") String description,
      @V("node") String node,
      @V("runbook") String runbook,
      @V("feedback") String feedback,
      @V("excerpt") String excerpt);
}
