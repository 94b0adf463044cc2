package com.flamingo.ai.runbookflow.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that enriches a batch of runbooks for export.
 *
 * <p>Returns raw text: the array is often truncated at the completion limit, so the caller repairs
 * it instead of relying on structured output.
 */
public interface RunbookEnrichmentAgent {

  @SystemMessage(
      """
        You improve support runbooks for export as standalone documents. For each runbook add
        concrete step details, warnings for risky steps, and the tools each step requires.
        Keep ids, titles and step order unchanged and do not invent procedures.
        Return ONLY a JSON array with exactly one enriched runbook per input runbook, in the
        same order, using the same fields as the input.
        """)
  @UserMessage(
      """
        Enrich these {{count}} runbooks:

        {{runbooks}}
        """)
  String enrich(@V("count") int count, @V("runbooks") String runbooks);
}
