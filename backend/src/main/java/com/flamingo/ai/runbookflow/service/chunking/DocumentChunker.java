package com.flamingo.ai.runbookflow.service.chunking;

import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.exception.ContentTooLargeException;
import java.util.List;

/**
 * Splits runbook text into token-bounded {@link Chunk}s for per-chunk concept extraction.
 *
 * <p>Implementations must be stateless and safe for concurrent use.
 */
public interface DocumentChunker {

  /**
   * Fails fast when the text would need more chunks than allowed. Performs no splitting.
   *
   * @param text the runbook text
   * @param maxTokensPerChunk token budget per chunk
   * @throws ContentTooLargeException when {@code ceil(tokens / maxTokensPerChunk)} exceeds the
   *     chunk ceiling
   */
  void validateSize(String text, int maxTokensPerChunk);

  /**
   * Splits the text into chunks of at most {@code maxTokensPerChunk} estimated tokens.
   *
   * @param text the runbook text
   * @param maxTokensPerChunk token budget per chunk
   * @return ordered chunks, a single chunk equal to {@code text} when it fits
   */
  List<Chunk> split(String text, int maxTokensPerChunk);

  /** Conservative token estimate, {@code ceil(length / charsPerToken)}. */
  int estimateTokens(String text);
}
