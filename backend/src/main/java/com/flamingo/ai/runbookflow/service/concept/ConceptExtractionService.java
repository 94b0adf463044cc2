package com.flamingo.ai.runbookflow.service.concept;

import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.exception.OracleCallException;

/** Extracts the concept graph of one chunk through the oracle. */
public interface ConceptExtractionService {

  /**
   * Extracts concepts from a chunk. One oracle call per invocation.
   *
   * @param chunk the chunk to analyze
   * @param chunkCount total number of chunks in the document
   * @return the chunk's concept graph, already deduplicated
   * @throws OracleCallException when the oracle fails or returns nothing usable
   */
  ConceptGraph extract(Chunk chunk, int chunkCount);
}
