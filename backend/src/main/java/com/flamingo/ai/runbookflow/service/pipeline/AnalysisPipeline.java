package com.flamingo.ai.runbookflow.service.pipeline;

import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.enums.ProgressStage;
import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.GraphMetadata;
import com.flamingo.ai.runbookflow.exception.ContentTooLargeException;
import com.flamingo.ai.runbookflow.exception.InvalidDocumentException;
import com.flamingo.ai.runbookflow.exception.MalformedGraphException;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.exception.PipelineCancelledException;
import com.flamingo.ai.runbookflow.service.chunking.DocumentChunker;
import com.flamingo.ai.runbookflow.service.concept.ConceptExtractionService;
import com.flamingo.ai.runbookflow.service.concept.ConceptGraphMerger;
import com.flamingo.ai.runbookflow.service.critique.GraphCritiqueService;
import com.flamingo.ai.runbookflow.service.graph.GraphLayoutService;
import com.flamingo.ai.runbookflow.service.graph.LabelNormalizer;
import com.flamingo.ai.runbookflow.service.refinement.GraphRefinementService;
import com.flamingo.ai.runbookflow.service.synthesis.GraphSynthesisService;
import com.flamingo.ai.runbookflow.service.synthesis.SynthesizedGraph;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs one document through chunking, per-chunk concept extraction, merge, synthesis, critique,
 * optional refinement, label normalization and layout.
 *
 * <p>Stages run sequentially on the calling thread. Cancellation is checked between states and
 * between chunk extractions. Synthesis failure ends the run; critique and refinement failures
 * degrade to the neutral report and the previous graph.
 */
@Component
@Slf4j
public class AnalysisPipeline {

  private final DocumentChunker chunker;
  private final ConceptExtractionService conceptExtractionService;
  private final ConceptGraphMerger merger;
  private final GraphSynthesisService synthesisService;
  private final GraphCritiqueService critiqueService;
  private final GraphRefinementService refinementService;
  private final LabelNormalizer labelNormalizer;
  private final GraphLayoutService layoutService;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public AnalysisPipeline(
      DocumentChunker chunker,
      ConceptExtractionService conceptExtractionService,
      ConceptGraphMerger merger,
      GraphSynthesisService synthesisService,
      GraphCritiqueService critiqueService,
      GraphRefinementService refinementService,
      LabelNormalizer labelNormalizer,
      GraphLayoutService layoutService,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry) {
    this(
        chunker,
        conceptExtractionService,
        merger,
        synthesisService,
        critiqueService,
        refinementService,
        labelNormalizer,
        layoutService,
        pipelineConfig,
        meterRegistry,
        Clock.systemUTC());
  }

  AnalysisPipeline(
      DocumentChunker chunker,
      ConceptExtractionService conceptExtractionService,
      ConceptGraphMerger merger,
      GraphSynthesisService synthesisService,
      GraphCritiqueService critiqueService,
      GraphRefinementService refinementService,
      LabelNormalizer labelNormalizer,
      GraphLayoutService layoutService,
      PipelineConfig pipelineConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.chunker = chunker;
    this.conceptExtractionService = conceptExtractionService;
    this.merger = merger;
    this.synthesisService = synthesisService;
    this.critiqueService = critiqueService;
    this.refinementService = refinementService;
    this.labelNormalizer = labelNormalizer;
    this.layoutService = layoutService;
    this.pipelineConfig = pipelineConfig;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Runs the pipeline and reports the outcome as events: a single complete or error event, or
   * nothing further when the consumer cancelled. Never throws.
   *
   * @return the terminal state
   */
  public PipelineState run(String markdown, ProgressSink sink) {
    ProgressEmitter emitter = new ProgressEmitter(sink);
    try {
      AnalysisResult result = execute(markdown, emitter);
      emitter.complete(result);
      return PipelineState.DONE;
    } catch (PipelineCancelledException e) {
      log.info("Analysis cancelled: {}", e.getMessage());
      meterRegistry.counter("pipeline.cancellations").increment();
      return PipelineState.CANCELLED;
    } catch (RuntimeException e) {
      if (emitter.isCancelled()) {
        // An interrupted oracle call surfaces as a failure after the consumer left
        log.info("Analysis cancelled during a stage: {}", e.getMessage());
        meterRegistry.counter("pipeline.cancellations").increment();
        return PipelineState.CANCELLED;
      }
      String errorId = UUID.randomUUID().toString().substring(0, 8);
      if (isExpected(e)) {
        log.error("Analysis failed [{}]: {}", errorId, e.getMessage());
      } else {
        log.error("Analysis failed unexpectedly [{}]: {}", errorId, e.getMessage(), e);
      }
      emitter.error(errorId, userMessage(e));
      return PipelineState.FAILED;
    }
  }

  /**
   * Runs the pipeline and returns the result, throwing the failure instead of emitting it.
   *
   * @throws InvalidDocumentException when the document is blank or too short
   * @throws ContentTooLargeException when the document needs too many chunks
   * @throws OracleCallException when synthesis cannot reach the oracle
   * @throws MalformedGraphException when synthesis returns an empty or malformed graph
   * @throws PipelineCancelledException when the emitter's sink was cancelled
   */
  public AnalysisResult execute(String markdown, ProgressEmitter emitter) {
    meterRegistry.counter("pipeline.runs").increment();
    try {
      return doExecute(markdown, emitter);
    } catch (PipelineCancelledException e) {
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("pipeline.failures").increment();
      throw e;
    }
  }

  private AnalysisResult doExecute(String markdown, ProgressEmitter emitter) {
    List<String> warnings = new ArrayList<>();

    // CHUNKING
    enter(PipelineState.CHUNKING, emitter);
    validateInput(markdown);
    emitter.progress(ProgressStage.PARSING, "Parsing runbook structure...", 5);
    int maxTokens = pipelineConfig.getChunking().getMaxTokensPerChunk();
    chunker.validateSize(markdown, maxTokens);
    List<Chunk> chunks = chunker.split(markdown, maxTokens);
    emitter.progress(
        ProgressStage.PARSING,
        "Runbook parsed",
        chunks.size() == 1 ? "Processing as a single section" : chunks.size() + " sections",
        10);

    // EXTRACTING
    enter(PipelineState.EXTRACTING, emitter);
    List<ConceptGraph> extracted = new ArrayList<>();
    for (Chunk chunk : chunks) {
      checkCancelled(emitter);
      int n = chunks.size();
      emitter.progress(
          ProgressStage.IDENTIFYING,
          "Extracting concepts...",
          "Section " + (chunk.index() + 1) + " of " + n,
          10 + 20 * chunk.index() / n);
      try {
        extracted.add(conceptExtractionService.extract(chunk, n));
      } catch (RuntimeException e) {
        // A failed chunk is skipped whatever the cause
        checkCancelled(emitter);
        log.warn("Skipping chunk {}/{}: {}", chunk.index() + 1, n, e.getMessage());
        warnings.add("Concept extraction failed for section " + (chunk.index() + 1));
        meterRegistry.counter("pipeline.fallbacks", "stage", "extraction").increment();
      }
    }
    if (extracted.isEmpty()) {
      log.warn("No concepts extracted from any chunk, synthesizing from source text only");
    }
    ConceptGraph concepts = merger.merge(extracted);
    emitter.progress(
        ProgressStage.IDENTIFYING,
        "Concepts identified",
        concepts.procedures().size()
            + " procedures, "
            + concepts.decisionPoints().size()
            + " decision points",
        32);

    // SYNTHESIZING
    enter(PipelineState.SYNTHESIZING, emitter);
    emitter.progress(ProgressStage.STRUCTURING, "Generating decision tree...", 35);
    StageOutcome<SynthesizedGraph> synthesis = synthesisService.synthesize(markdown, concepts);
    if (synthesis.isFatal()) {
      throw synthesis.error();
    }
    SynthesizedGraph current = synthesis.value();
    emitter.progress(
        ProgressStage.STRUCTURING,
        "Decision tree generated",
        current.graph().getNodes().size() + " nodes",
        55);

    // CRITIQUING
    enter(PipelineState.CRITIQUING, emitter);
    emitter.progress(ProgressStage.STRUCTURING, "Reviewing decision tree...", 60);
    StageOutcome<CritiqueReport> critique = critiqueService.critique(current.graph(), markdown);
    CritiqueReport report = critique.value();
    if (critique.isFallback()) {
      warnings.add(critique.reason());
      meterRegistry.counter("pipeline.fallbacks", "stage", "critique").increment();
    }
    emitter.progress(
        ProgressStage.STRUCTURING,
        "Review complete",
        "Score " + report.score() + "/10, " + report.issues().size() + " issues",
        70);

    // REFINING
    boolean refined = false;
    if (refinementService.shouldRefine(report)) {
      enter(PipelineState.REFINING, emitter);
      emitter.progress(
          ProgressStage.GENERATING,
          "Refining decision tree...",
          "Fixing " + report.issues().size() + " issues",
          75);
      StageOutcome<SynthesizedGraph> refinement =
          refinementService.refine(current, report, markdown);
      checkCancelled(emitter);
      if (refinement.isFallback()) {
        warnings.add(refinement.reason());
        meterRegistry.counter("pipeline.fallbacks", "stage", "refinement").increment();
      } else {
        refined = true;
        meterRegistry.counter("pipeline.refinements").increment();
      }
      current = refinement.value();
      emitter.progress(
          ProgressStage.GENERATING,
          refined ? "Decision tree refined" : "Keeping original decision tree",
          85);
    }

    DecisionGraph graph = current.graph();

    // NORMALIZING
    enter(PipelineState.NORMALIZING, emitter);
    emitter.progress(ProgressStage.GENERATING, "Polishing labels...", 90);
    int relabelled = labelNormalizer.normalize(graph);
    log.debug("Normalized {} question labels", relabelled);

    // LAYING_OUT
    enter(PipelineState.LAYING_OUT, emitter);
    emitter.progress(ProgressStage.GENERATING, "Laying out flowchart...", 95);
    layoutService.layout(graph);

    GraphMetadata metadata =
        graph.getMetadata() != null
            ? graph.getMetadata()
            : new GraphMetadata(null, null, null, null, null);
    graph.setMetadata(metadata.withGeneration(Instant.now(clock), markdown));

    enter(PipelineState.DONE, emitter);
    AnalysisSummary summary =
        new AnalysisSummary(
            chunks.size(),
            report.score(),
            report.passesReview(),
            refined,
            report.issues(),
            warnings);
    log.info(
        "Analysis complete: {} chunks, {} nodes, score {}, refined={}, {} warnings",
        chunks.size(),
        graph.getNodes().size(),
        report.score(),
        refined,
        warnings.size());
    return new AnalysisResult(graph.snapshot(), current.reasoning(), summary);
  }

  private void validateInput(String markdown) {
    if (markdown == null || markdown.isBlank()) {
      throw new InvalidDocumentException("Runbook content is required");
    }
    int minLength = pipelineConfig.getInput().getMinLength();
    if (markdown.trim().length() < minLength) {
      throw new InvalidDocumentException(
          "Runbook content is too short. Please provide at least " + minLength + " characters.");
    }
  }

  private void enter(PipelineState state, ProgressEmitter emitter) {
    checkCancelled(emitter);
    log.debug("Pipeline state -> {}", state);
  }

  private void checkCancelled(ProgressEmitter emitter) {
    if (emitter.isCancelled() || Thread.currentThread().isInterrupted()) {
      throw new PipelineCancelledException("Consumer disconnected");
    }
  }

  private static boolean isExpected(RuntimeException e) {
    return e instanceof ContentTooLargeException
        || e instanceof InvalidDocumentException
        || e instanceof OracleCallException
        || e instanceof MalformedGraphException;
  }

  static String userMessage(RuntimeException e) {
    if (e instanceof ContentTooLargeException tooLarge) {
      return tooLarge.getUserMessage();
    }
    if (e instanceof InvalidDocumentException) {
      return e.getMessage();
    }
    if (e instanceof OracleCallException oracle) {
      return oracle.getUserMessage();
    }
    if (e instanceof MalformedGraphException malformed) {
      return malformed.getUserMessage();
    }
    return "An unexpected error occurred. Please try again later.";
  }
}
