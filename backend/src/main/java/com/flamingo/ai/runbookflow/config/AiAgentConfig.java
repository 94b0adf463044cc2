package com.flamingo.ai.runbookflow.config;

import com.flamingo.ai.runbookflow.agent.ConceptExtractionAgent;
import com.flamingo.ai.runbookflow.agent.GraphCritiqueAgent;
import com.flamingo.ai.runbookflow.agent.GraphRefinementAgent;
import com.flamingo.ai.runbookflow.agent.GraphSynthesisAgent;
import com.flamingo.ai.runbookflow.agent.NodeRegenerationAgent;
import com.flamingo.ai.runbookflow.agent.RunbookEnrichmentAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the oracle agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder(). Each agent has a typed result record, so a response
 * that does not match the schema fails at the call instead of leaking into the pipeline.
 */
@Configuration
public class AiAgentConfig {

  /** Per-chunk concept extraction. */
  @Bean
  public ConceptExtractionAgent conceptExtractionAgent(
      @Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(ConceptExtractionAgent.class).chatModel(chatModel).build();
  }

  /** Initial decision graph generation from the merged concept graph. */
  @Bean
  public GraphSynthesisAgent graphSynthesisAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(GraphSynthesisAgent.class).chatModel(chatModel).build();
  }

  /** Structural review of a generated graph. */
  @Bean
  public GraphCritiqueAgent graphCritiqueAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(GraphCritiqueAgent.class).chatModel(chatModel).build();
  }

  /** Single corrective pass driven by the critique. */
  @Bean
  public GraphRefinementAgent graphRefinementAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(GraphRefinementAgent.class).chatModel(chatModel).build();
  }

  /** Single-node rewrite on user request. */
  @Bean
  public NodeRegenerationAgent nodeRegenerationAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(NodeRegenerationAgent.class).chatModel(chatModel).build();
  }

  /**
   * Batch runbook enrichment. Uses textChatModel (no JSON response format) and returns raw text so
   * truncated output can be repaired.
   */
  @Bean
  public RunbookEnrichmentAgent runbookEnrichmentAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(RunbookEnrichmentAgent.class).chatModel(textChatModel).build();
  }
}
