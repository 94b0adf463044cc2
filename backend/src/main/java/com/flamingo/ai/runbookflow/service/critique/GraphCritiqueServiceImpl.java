package com.flamingo.ai.runbookflow.service.critique;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.agent.dto.CritiqueIssuePayload;
import com.flamingo.ai.runbookflow.agent.dto.CritiqueResult;
import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.enums.IssueType;
import com.flamingo.ai.runbookflow.domain.model.CritiqueIssue;
import com.flamingo.ai.runbookflow.domain.model.CritiqueReport;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.service.graph.GraphStructureInspector;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import com.flamingo.ai.runbookflow.service.pipeline.StageOutcome;
import com.flamingo.ai.runbookflow.service.synthesis.SourceExcerpt;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link GraphCritiqueService}.
 *
 * <p>The oracle's report is normalized (score clamped to 1-10, unknown issue types dropped) and
 * merged with {@link GraphStructureInspector} findings. Blocking issues always fail review. When
 * the oracle call fails the neutral report is returned without inspector findings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphCritiqueServiceImpl implements GraphCritiqueService {

  private final OracleClient oracleClient;
  private final GraphStructureInspector inspector;
  private final ObjectMapper objectMapper;
  private final PipelineConfig pipelineConfig;

  @Override
  @Timed(value = "pipeline.critique", description = "Time to critique the decision graph")
  public StageOutcome<CritiqueReport> critique(DecisionGraph graph, String sourceText) {
    CritiqueResult result;
    try {
      String graphJson = objectMapper.writeValueAsString(graph.snapshot());
      String content =
          SourceExcerpt.truncate(
              sourceText, pipelineConfig.getSynthesis().getMaxSourceChars());
      result = oracleClient.critiqueGraph(graphJson, content);
    } catch (Exception e) {
      log.warn("Critique failed, continuing with neutral report: {}", e.getMessage());
      return StageOutcome.fallback(
          CritiqueReport.neutral("Critique unavailable: " + e.getMessage()), e.getMessage());
    }

    List<CritiqueIssue> issues = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    if (result.issues() != null) {
      for (CritiqueIssuePayload payload : result.issues()) {
        toIssue(payload)
            .ifPresent(
                issue -> {
                  issues.add(issue);
                  seen.add(key(issue));
                });
      }
    }
    int fromOracle = issues.size();
    for (CritiqueIssue finding : inspector.inspect(graph)) {
      if (seen.add(key(finding))) {
        issues.add(finding);
      }
    }

    int score = clamp(result.score());
    boolean oraclePasses = Boolean.TRUE.equals(result.passesReview());
    CritiqueReport report = new CritiqueReport(score, issues, oraclePasses, result.summary());
    if (oraclePasses && report.hasBlockingIssues()) {
      report = new CritiqueReport(score, issues, false, result.summary());
    }

    log.info(
        "Critique: score {}, {} issues ({} from structure checks), passesReview={}",
        score,
        issues.size(),
        issues.size() - fromOracle,
        report.passesReview());
    return StageOutcome.ok(report);
  }

  private Optional<CritiqueIssue> toIssue(CritiqueIssuePayload payload) {
    if (payload == null) {
      return Optional.empty();
    }
    Optional<IssueType> type = IssueType.fromValue(payload.type());
    if (type.isEmpty()) {
      log.debug("Dropping critique issue with unknown type: {}", payload.type());
      return Optional.empty();
    }
    return Optional.of(
        new CritiqueIssue(
            type.get(), payload.nodeId(), payload.description(), payload.suggestion()));
  }

  private static String key(CritiqueIssue issue) {
    return issue.type().getValue() + "|" + issue.nodeId();
  }

  private static int clamp(Integer score) {
    if (score == null) {
      return CritiqueReport.NEUTRAL_SCORE;
    }
    return Math.max(1, Math.min(10, score));
  }
}
