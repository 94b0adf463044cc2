package com.flamingo.ai.runbookflow.agent;

import com.flamingo.ai.runbookflow.agent.dto.GraphGenerationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that produces a corrected decision graph from a critique. */
public interface GraphRefinementAgent {

  @SystemMessage(
      """
        You are an expert at repairing support decision trees. You receive a flowchart, the
        reviewer's issues, and the source runbook. Fix every listed issue while keeping all
        correct parts of the flowchart, including node ids where possible. Return the complete
        corrected flowchart, never a partial diff. Explain the fixes in "reasoning".
        """)
  @UserMessage(
      """
        {{rules}}

        ## CURRENT FLOWCHART

        {{graph}}

        ## REVIEW

        {{critique}}

        ## RUNBOOK

        {{content}}

        {{outputFormat}}
        """)
  GraphGenerationResult refine(
      @V("rules") String rules,
      @V("graph") String graph,
      @V("critique") String critique,
      @V("content") String content,
      @V("outputFormat") String outputFormat);
}
