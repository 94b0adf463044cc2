package com.flamingo.ai.runbookflow.service.graph;

import com.flamingo.ai.runbookflow.domain.enums.IssueType;
import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.model.CritiqueIssue;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowEdge;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.Runbook;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Deterministic structural checks that complement the oracle's critique.
 *
 * <p>Finds two blocking defects:
 *
 * <ul>
 *   <li>{@code disconnected_node}: a non-start node without incoming edge, a node that is neither
 *       an end nor a runbook node without outgoing edge, an edge to an unknown node, or a runbook
 *       node pointing at a missing runbook.
 *   <li>{@code merged_paths}: a question with two or more answer branches whose descendant question
 *       or answer nodes are shared between branches. Runbook and end nodes may be shared.
 * </ul>
 */
@Component
@Slf4j
public class GraphStructureInspector {

  public List<CritiqueIssue> inspect(DecisionGraph graph) {
    List<CritiqueIssue> issues = new ArrayList<>();
    Map<String, FlowNode> nodesById = new LinkedHashMap<>();
    for (FlowNode node : graph.getNodes()) {
      nodesById.putIfAbsent(node.getId(), node);
    }

    Map<String, List<String>> children = new HashMap<>();
    Set<String> withIncoming = new HashSet<>();
    for (FlowEdge edge : graph.getEdges()) {
      if (!nodesById.containsKey(edge.source()) || !nodesById.containsKey(edge.target())) {
        String missing = nodesById.containsKey(edge.source()) ? edge.target() : edge.source();
        issues.add(
            disconnected(
                nodesById.containsKey(edge.source()) ? edge.source() : null,
                "Edge " + edge.id() + " references unknown node " + missing,
                "Remove the edge or add the missing node"));
        continue;
      }
      children.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
      withIncoming.add(edge.target());
    }

    Set<String> runbookIds =
        graph.getRunbooks().stream().map(Runbook::id).collect(Collectors.toSet());

    for (FlowNode node : nodesById.values()) {
      NodeKind kind = node.getKind();
      if (kind != NodeKind.START && !withIncoming.contains(node.getId())) {
        issues.add(
            disconnected(
                node.getId(),
                "Node '" + node.getLabel() + "' has no incoming edge",
                "Connect it to the branch it belongs to or remove it"));
      }
      if (!kind.isTerminal()
          && kind != NodeKind.RUNBOOK
          && children.getOrDefault(node.getId(), List.of()).isEmpty()) {
        issues.add(
            disconnected(
                node.getId(),
                "Node '" + node.getLabel() + "' is a dead end",
                "Add an outgoing edge to the next step or an end node"));
      }
      if (kind == NodeKind.RUNBOOK
          && node.getRunbookId() != null
          && !runbookIds.contains(node.getRunbookId())) {
        issues.add(
            disconnected(
                node.getId(),
                "Runbook node points at missing runbook " + node.getRunbookId(),
                "Add the runbook or fix the reference"));
      }
    }

    for (FlowNode node : nodesById.values()) {
      if (node.getKind() == NodeKind.QUESTION) {
        findMergedPaths(node, nodesById, children).ifPresent(issues::add);
      }
    }

    if (!issues.isEmpty()) {
      log.debug("Structure inspection found {} issues", issues.size());
    }
    return issues;
  }

  private Optional<CritiqueIssue> findMergedPaths(
      FlowNode question, Map<String, FlowNode> nodesById, Map<String, List<String>> children) {
    List<String> answers =
        children.getOrDefault(question.getId(), List.of()).stream()
            .filter(id -> nodesById.get(id).getKind() == NodeKind.ANSWER)
            .distinct()
            .toList();
    if (answers.size() < 2) {
      return Optional.empty();
    }

    Map<String, String> owner = new HashMap<>();
    Set<String> shared = new LinkedHashSet<>();
    for (String answer : answers) {
      for (String descendant : branchNodes(answer, question.getId(), nodesById, children)) {
        String previous = owner.putIfAbsent(descendant, answer);
        if (previous != null && !previous.equals(answer)) {
          shared.add(descendant);
        }
      }
    }
    if (shared.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new CritiqueIssue(
            IssueType.MERGED_PATHS,
            question.getId(),
            "Branches of '"
                + question.getLabel()
                + "' reconverge at "
                + String.join(", ", shared),
            "Give each branch its own copy of the shared steps"));
  }

  /** Question and answer nodes reachable from a branch root, the branch root included. */
  private Set<String> branchNodes(
      String branchRoot,
      String splitId,
      Map<String, FlowNode> nodesById,
      Map<String, List<String>> children) {
    Set<String> seen = new LinkedHashSet<>();
    Deque<String> queue = new ArrayDeque<>();
    queue.add(branchRoot);
    seen.add(branchRoot);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      for (String child : children.getOrDefault(current, List.of())) {
        NodeKind kind = nodesById.get(child).getKind();
        if (child.equals(splitId) || (kind != NodeKind.QUESTION && kind != NodeKind.ANSWER)) {
          continue;
        }
        if (seen.add(child)) {
          queue.add(child);
        }
      }
    }
    return seen;
  }

  private static CritiqueIssue disconnected(String nodeId, String description, String suggestion) {
    return new CritiqueIssue(IssueType.DISCONNECTED_NODE, nodeId, description, suggestion);
  }
}
