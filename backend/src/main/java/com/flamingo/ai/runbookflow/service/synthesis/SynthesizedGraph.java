package com.flamingo.ai.runbookflow.service.synthesis;

import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;

/**
 * A validated graph together with the oracle's explanation of it.
 *
 * @param graph the decision graph
 * @param reasoning how the oracle decomposed the document, or what it fixed, may be null
 */
public record SynthesizedGraph(DecisionGraph graph, String reasoning) {}
