package com.flamingo.ai.runbookflow.service.regeneration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.agent.dto.NodePayload;
import com.flamingo.ai.runbookflow.agent.dto.NodeRegenerationResult;
import com.flamingo.ai.runbookflow.agent.dto.RunbookPayload;
import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.enums.RegenerationMode;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.GraphMetadata;
import com.flamingo.ai.runbookflow.domain.model.Runbook;
import com.flamingo.ai.runbookflow.exception.NodeNotFoundException;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.service.graph.DecisionGraphMapper;
import com.flamingo.ai.runbookflow.service.graph.LabelNormalizer;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link NodeRegenerationService} using the node regeneration agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NodeRegenerationServiceImpl implements NodeRegenerationService {

  static final int EXCERPT_CHARS = 2000;

  private final OracleClient oracleClient;
  private final DecisionGraphMapper mapper;
  private final LabelNormalizer labelNormalizer;
  private final ObjectMapper objectMapper;

  @Override
  @Timed(value = "regeneration.node", description = "Time to regenerate a node")
  public RegeneratedNode regenerate(
      DecisionGraph graph, String nodeId, String feedback, RegenerationMode mode) {
    FlowNode original = graph.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    Runbook originalRunbook =
        original.getRunbookId() != null
            ? graph.findRunbook(original.getRunbookId()).orElse(null)
            : null;
    GraphMetadata metadata = graph.getMetadata();

    NodeRegenerationResult result;
    try {
      result =
          oracleClient.regenerateNode(
              mode.getValue(),
              metadata != null && metadata.title() != null ? metadata.title() : "",
              metadata != null && metadata.description() != null ? metadata.description() : "",
              objectMapper.writeValueAsString(original),
              originalRunbook != null ? objectMapper.writeValueAsString(originalRunbook) : "none",
              feedback != null && !feedback.isBlank() ? feedback : "none",
              excerpt(metadata, original));
    } catch (JsonProcessingException e) {
      throw new OracleCallException("regenerating a node", e.getMessage(), e);
    }

    if (result.node() == null) {
      throw new OracleCallException("regenerating a node", "Oracle returned no node", null);
    }

    FlowNode node = mapper.toNode(withIdentity(result.node(), original));
    node.setPosition(original.getPosition());
    node.setDepth(original.getDepth());
    node.setCollapsed(original.getCollapsed());
    if (node.getKind() == NodeKind.QUESTION) {
      node.setLabel(labelNormalizer.normalizeLabel(node.getLabel()));
    }

    Runbook runbook = null;
    RunbookPayload runbookPayload = result.runbook();
    if (original.getKind() == NodeKind.RUNBOOK
        && original.getRunbookId() != null
        && runbookPayload != null) {
      Runbook candidate = mapper.toRunbook(withRunbookId(runbookPayload, original.getRunbookId()));
      runbook = candidate.steps().isEmpty() ? null : candidate;
    }

    log.info(
        "Regenerated {} node {} ({}){}",
        original.getKind().getValue(),
        nodeId,
        mode.getValue(),
        runbook != null ? " with its runbook" : "");
    return new RegeneratedNode(node, runbook);
  }

  /** Source text around the node's quote, or the start of the document. */
  static String excerpt(GraphMetadata metadata, FlowNode node) {
    String markdown = metadata != null ? metadata.originalMarkdown() : null;
    if (markdown == null || markdown.isEmpty()) {
      return "none";
    }
    int start = 0;
    if (node.getSourceRef() != null && node.getSourceRef().quote() != null) {
      int found = markdown.indexOf(node.getSourceRef().quote());
      if (found >= 0) {
        start = Math.max(0, found - EXCERPT_CHARS / 4);
      }
    }
    return markdown.substring(start, Math.min(markdown.length(), start + EXCERPT_CHARS));
  }

  private static NodePayload withIdentity(NodePayload payload, FlowNode original) {
    return new NodePayload(
        original.getId(),
        original.getKind().getValue(),
        payload.label() != null && !payload.label().isBlank()
            ? payload.label()
            : original.getLabel(),
        payload.description(),
        payload.question() != null ? payload.question() : original.getQuestion(),
        payload.sourceRef() != null ? payload.sourceRef() : original.getSourceRef(),
        original.getRunbookId(),
        payload.endStateType() != null
            ? payload.endStateType()
            : original.getEndStateType() != null ? original.getEndStateType().getValue() : null);
  }

  private static RunbookPayload withRunbookId(RunbookPayload payload, String id) {
    return new RunbookPayload(
        id,
        payload.title(),
        payload.description(),
        payload.steps(),
        payload.prerequisites(),
        payload.notes(),
        payload.relatedRunbookIds(),
        payload.sourceRef());
  }
}
