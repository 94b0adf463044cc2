package com.flamingo.ai.runbookflow.domain.model;

/**
 * Where a node or runbook came from in the source document.
 *
 * @param quote exact quote from the original markdown
 * @param section heading the quote came from, may be null
 * @param reasoning why the quote led to this node
 */
public record SourceReference(String quote, String section, String reasoning) {}
