package com.flamingo.ai.runbookflow.service.graph;

import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowEdge;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.Position;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hierarchical layout of a decision graph.
 *
 * <p>Depth is the level at which a breadth-first search started from all roots at once first
 * reaches a node. Roots are taken in node order and children in edge order, so the same graph
 * always gets the same layout. A node reachable on two paths keeps the depth of the first visit.
 *
 * <p>Within a level nodes are spaced by {@code nodeWidth + horizontalSpacing} and centred on x=0;
 * {@code y = depth * (nodeHeight + verticalSpacing)}. Nodes never reached (no root leads to them)
 * get depth 0 at the origin and are left expanded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphLayoutService {

  private final PipelineConfig pipelineConfig;

  /** Decorates the graph's nodes in place and returns the same graph. */
  public DecisionGraph layout(DecisionGraph graph) {
    layout(graph.getNodes(), graph.getEdges());
    return graph;
  }

  /** Decorates {@code nodes} in place with depth, position and collapsed state. */
  public List<FlowNode> layout(List<FlowNode> nodes, List<FlowEdge> edges) {
    PipelineConfig.Layout config = pipelineConfig.getLayout();

    Map<String, FlowNode> byId = new LinkedHashMap<>();
    for (FlowNode node : nodes) {
      byId.putIfAbsent(node.getId(), node);
    }

    Map<String, List<String>> forward = new HashMap<>();
    Set<String> hasIncoming = new HashSet<>();
    for (FlowEdge edge : edges) {
      // Dangling edges are the inspector's concern
      if (!byId.containsKey(edge.source()) || !byId.containsKey(edge.target())) {
        continue;
      }
      forward.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
      hasIncoming.add(edge.target());
    }

    Map<String, Integer> depths = new HashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String id : byId.keySet()) {
      if (!hasIncoming.contains(id)) {
        depths.put(id, 0);
        queue.add(id);
      }
    }

    // Visit order doubles as the horizontal order within a level
    Map<Integer, List<String>> levels = new TreeMap<>();
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int depth = depths.get(current);
      levels.computeIfAbsent(depth, k -> new ArrayList<>()).add(current);
      for (String child : forward.getOrDefault(current, List.of())) {
        if (!depths.containsKey(child)) {
          depths.put(child, depth + 1);
          queue.add(child);
        }
      }
    }

    double columnStep = config.getNodeWidth() + config.getHorizontalSpacing();
    double rowStep = config.getNodeHeight() + config.getVerticalSpacing();
    for (Map.Entry<Integer, List<String>> level : levels.entrySet()) {
      int depth = level.getKey();
      List<String> ids = level.getValue();
      double centre = (ids.size() - 1) / 2.0;
      for (int i = 0; i < ids.size(); i++) {
        FlowNode node = byId.get(ids.get(i));
        node.setDepth(depth);
        node.setPosition(new Position((i - centre) * columnStep, depth * rowStep));
        node.setCollapsed(depth > config.getCollapseDepth());
      }
    }

    int unreached = 0;
    for (FlowNode node : nodes) {
      if (!depths.containsKey(node.getId())) {
        node.setDepth(0);
        node.setPosition(Position.ORIGIN);
        node.setCollapsed(false);
        unreached++;
      } else if (node != byId.get(node.getId())) {
        // Duplicate id: mirror the first node's placement
        FlowNode first = byId.get(node.getId());
        node.setDepth(first.getDepth());
        node.setPosition(first.getPosition());
        node.setCollapsed(first.getCollapsed());
      }
    }
    if (unreached > 0) {
      log.warn("Layout could not reach {} of {} nodes from any root", unreached, nodes.size());
    }
    log.debug("Laid out {} nodes over {} levels", nodes.size(), levels.size());
    return nodes;
  }
}
