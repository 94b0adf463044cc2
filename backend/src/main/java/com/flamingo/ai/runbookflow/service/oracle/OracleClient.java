package com.flamingo.ai.runbookflow.service.oracle;

import com.flamingo.ai.runbookflow.agent.ConceptExtractionAgent;
import com.flamingo.ai.runbookflow.agent.GraphCritiqueAgent;
import com.flamingo.ai.runbookflow.agent.GraphRefinementAgent;
import com.flamingo.ai.runbookflow.agent.GraphSynthesisAgent;
import com.flamingo.ai.runbookflow.agent.NodeRegenerationAgent;
import com.flamingo.ai.runbookflow.agent.RunbookEnrichmentAgent;
import com.flamingo.ai.runbookflow.agent.dto.CritiqueResult;
import com.flamingo.ai.runbookflow.agent.dto.ExtractedConcepts;
import com.flamingo.ai.runbookflow.agent.dto.GraphGenerationResult;
import com.flamingo.ai.runbookflow.agent.dto.NodeRegenerationResult;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.exception.OracleUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Boundary to the generative oracle. Every agent call goes through here so retries, circuit
 * breaking and timeouts stay outside the pipeline, and every failure surfaces as {@link
 * OracleCallException}, including rejections by an open breaker.
 *
 * <p>A {@code null} result counts as a failure: callers never see an absent response.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleClient {

  private final ConceptExtractionAgent conceptExtractionAgent;
  private final GraphSynthesisAgent graphSynthesisAgent;
  private final GraphCritiqueAgent graphCritiqueAgent;
  private final GraphRefinementAgent graphRefinementAgent;
  private final RunbookEnrichmentAgent runbookEnrichmentAgent;
  private final NodeRegenerationAgent nodeRegenerationAgent;
  private final MeterRegistry meterRegistry;

  @Retry(name = "oracle")
  @CircuitBreaker(name = "oracle", fallbackMethod = "extractConceptsFallback")
  public ExtractedConcepts extractConcepts(int chunkNumber, int chunkCount, String content) {
    return call(
        "extracting concepts",
        () -> conceptExtractionAgent.extract(chunkNumber, chunkCount, content));
  }

  @Retry(name = "oracle")
  @CircuitBreaker(name = "oracle", fallbackMethod = "synthesizeGraphFallback")
  public GraphGenerationResult synthesizeGraph(String conceptGraph, String content) {
    return call(
        "generating the flowchart",
        () ->
            graphSynthesisAgent.synthesize(
                GraphSynthesisAgent.GRAPH_RULES,
                conceptGraph,
                content,
                GraphSynthesisAgent.OUTPUT_FORMAT));
  }

  @CircuitBreaker(name = "oracle", fallbackMethod = "critiqueGraphFallback")
  public CritiqueResult critiqueGraph(String graph, String content) {
    return call("reviewing the flowchart", () -> graphCritiqueAgent.critique(graph, content));
  }

  @CircuitBreaker(name = "oracle", fallbackMethod = "refineGraphFallback")
  public GraphGenerationResult refineGraph(String graph, String critique, String content) {
    return call(
        "refining the flowchart",
        () ->
            graphRefinementAgent.refine(
                GraphSynthesisAgent.GRAPH_RULES,
                graph,
                critique,
                content,
                GraphSynthesisAgent.OUTPUT_FORMAT));
  }

  @Retry(name = "oracle")
  @CircuitBreaker(name = "oracle", fallbackMethod = "enrichRunbooksFallback")
  public String enrichRunbooks(int count, String runbooks) {
    return call("enriching runbooks", () -> runbookEnrichmentAgent.enrich(count, runbooks));
  }

  @CircuitBreaker(name = "oracle", fallbackMethod = "regenerateNodeFallback")
  public NodeRegenerationResult regenerateNode(
      String mode,
      String title,
      String description,
      String node,
      String runbook,
      String feedback,
      String excerpt) {
    return call(
        "regenerating a node",
        () ->
            nodeRegenerationAgent.regenerate(
                mode, title, description, node, runbook, feedback, excerpt));
  }

  @SuppressWarnings("unused")
  private ExtractedConcepts extractConceptsFallback(
      int chunkNumber, int chunkCount, String content, Throwable t) {
    throw translate("extracting concepts", t);
  }

  @SuppressWarnings("unused")
  private GraphGenerationResult synthesizeGraphFallback(
      String conceptGraph, String content, Throwable t) {
    throw translate("generating the flowchart", t);
  }

  @SuppressWarnings("unused")
  private CritiqueResult critiqueGraphFallback(String graph, String content, Throwable t) {
    throw translate("reviewing the flowchart", t);
  }

  @SuppressWarnings("unused")
  private GraphGenerationResult refineGraphFallback(
      String graph, String critique, String content, Throwable t) {
    throw translate("refining the flowchart", t);
  }

  @SuppressWarnings("unused")
  private String enrichRunbooksFallback(int count, String runbooks, Throwable t) {
    throw translate("enriching runbooks", t);
  }

  @SuppressWarnings("unused")
  private NodeRegenerationResult regenerateNodeFallback(
      String mode,
      String title,
      String description,
      String node,
      String runbook,
      String feedback,
      String excerpt,
      Throwable t) {
    throw translate("regenerating a node", t);
  }

  /**
   * Maps whatever escaped the breaker to {@link OracleCallException}. Failures from {@link #call}
   * pass through unchanged; a rejection by an open breaker becomes {@link
   * OracleUnavailableException}.
   */
  private OracleCallException translate(String operation, Throwable t) {
    if (t instanceof OracleCallException) {
      return (OracleCallException) t;
    }
    meterRegistry.counter("oracle.errors", "operation", operation).increment();
    if (t instanceof CallNotPermittedException) {
      log.warn("Oracle call '{}' rejected: {}", operation, t.getMessage());
      return new OracleUnavailableException(operation, t);
    }
    log.warn("Oracle call '{}' failed: {}", operation, t.getMessage());
    return new OracleCallException(operation, t.getMessage(), t);
  }

  private <T> T call(String operation, Supplier<T> invocation) {
    meterRegistry.counter("oracle.calls", "operation", operation).increment();
    long start = System.nanoTime();
    try {
      T result = invocation.get();
      if (result == null) {
        throw new OracleCallException(operation, "Oracle returned no result", null);
      }
      long elapsedMs = (System.nanoTime() - start) / 1_000_000;
      log.debug("Oracle call '{}' completed in {} ms", operation, elapsedMs);
      return result;
    } catch (OracleCallException e) {
      meterRegistry.counter("oracle.errors", "operation", operation).increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("oracle.errors", "operation", operation).increment();
      boolean rateLimited = isRateLimited(e);
      log.warn(
          "Oracle call '{}' failed{}: {}",
          operation,
          rateLimited ? " (rate limited)" : "",
          e.getMessage());
      throw new OracleCallException(operation, e.getMessage(), e, rateLimited);
    }
  }

  private boolean isRateLimited(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      String message = t.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("429") || lower.contains("rate limit")) {
          return true;
        }
      }
    }
    return false;
  }
}
