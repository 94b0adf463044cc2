package com.flamingo.ai.runbookflow.domain.model;

/**
 * An ordered, token-bounded slice of the source document.
 *
 * @param index zero-based position of the chunk
 * @param text chunk content (may start with the re-prefixed document preamble)
 * @param estimatedTokens token estimate for {@code text}
 */
public record Chunk(int index, String text, int estimatedTokens) {}
