package com.flamingo.ai.runbookflow.agent.dto;

import com.flamingo.ai.runbookflow.domain.model.DecisionPoint;
import com.flamingo.ai.runbookflow.domain.model.Procedure;
import java.util.List;

/**
 * Structured output from ConceptExtractionAgent for one chunk. LangChain4j deserializes the LLM
 * JSON response to this record.
 */
public record ExtractedConcepts(
    List<String> principles,
    List<String> userTypes,
    List<String> issueCategories,
    List<Procedure> procedures,
    List<DecisionPoint> decisionPoints,
    List<String> conceptOrder // concept names, most fundamental first
    ) {}
