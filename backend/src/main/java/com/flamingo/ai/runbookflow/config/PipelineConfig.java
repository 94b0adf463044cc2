package com.flamingo.ai.runbookflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the runbook analysis pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Chunking chunking = new Chunking();
  private Input input = new Input();
  private Synthesis synthesis = new Synthesis();
  private Refinement refinement = new Refinement();
  private Layout layout = new Layout();
  private Enrichment enrichment = new Enrichment();

  @Getter
  @Setter
  public static class Chunking {
    private int maxTokensPerChunk = 8000;

    /** Requests needing more chunks than this are rejected before any oracle call. */
    private int maxChunks = 10;

    private int charsPerToken = 4;
  }

  @Getter
  @Setter
  public static class Input {
    private int minLength = 50;
  }

  @Getter
  @Setter
  public static class Synthesis {
    /** Source text sent next to the concept graph is truncated to this many characters. */
    private int maxSourceChars = 60_000;
  }

  @Getter
  @Setter
  public static class Refinement {
    private boolean enabled = true;

    /** Graphs scoring at or above this are never refined. */
    private int scoreThreshold = 8;
  }

  @Getter
  @Setter
  public static class Layout {
    private int nodeWidth = 280;
    private int nodeHeight = 120;
    private int horizontalSpacing = 80;
    private int verticalSpacing = 150;

    /** Nodes deeper than this start collapsed. */
    private int collapseDepth = 1;
  }

  @Getter
  @Setter
  public static class Enrichment {
    private int batchSize = 5;
  }
}
