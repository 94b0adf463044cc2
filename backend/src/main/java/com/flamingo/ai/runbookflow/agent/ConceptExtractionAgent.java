package com.flamingo.ai.runbookflow.agent;

import com.flamingo.ai.runbookflow.agent.dto.ExtractedConcepts;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that extracts the concept graph of one runbook chunk: principles, user types, issue
 * categories, procedures, decision points, and the dependency order of concepts.
 */
public interface ConceptExtractionAgent {

  @SystemMessage(
      """
        You are an expert at analyzing technical support runbooks. Extract the domain concepts
        of the provided runbook excerpt and return a JSON object with these fields:

        1. "principles": guiding rules the runbook states or implies (strings).
        2. "userTypes": the kinds of users the runbook distinguishes (e.g. "Provider", "Patient").
        3. "issueCategories": the categories of problems covered (e.g. "Login", "Billing").
        4. "procedures": array of {"name", "prerequisites", "steps", "outcomes"} for every
           procedure the excerpt describes. Steps are short imperative sentences.
        5. "decisionPoints": array of {"question", "dependsOn", "determines"}. "dependsOn" lists
           concepts that must be known before the question makes sense; "determines" lists what
           its answer selects.
        6. "conceptOrder": concept names ordered by fundamentalness, the dimension that affects
           the most downstream decisions first.

        Only report what the excerpt supports. Use empty arrays for missing fields.
        Return ONLY valid JSON.
        """)
  @UserMessage(
      """
        Runbook excerpt {{chunkNumber}} of {{chunkCount}}:

        {{content}}
        """)
  ExtractedConcepts extract(
      @V("chunkNumber") int chunkNumber,
      @V("chunkCount") int chunkCount,
      @V("content") String content);
}
