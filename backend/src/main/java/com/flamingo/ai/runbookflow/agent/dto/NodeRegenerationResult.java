package com.flamingo.ai.runbookflow.agent.dto;

/**
 * Structured output from NodeRegenerationAgent.
 *
 * @param node rewritten node, same id as the original
 * @param runbook replacement runbook for runbook nodes, may be null
 */
public record NodeRegenerationResult(NodePayload node, RunbookPayload runbook) {}
