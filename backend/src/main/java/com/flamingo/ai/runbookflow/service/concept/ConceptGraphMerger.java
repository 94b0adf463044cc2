package com.flamingo.ai.runbookflow.service.concept;

import com.flamingo.ai.runbookflow.domain.model.ConceptGraph;
import com.flamingo.ai.runbookflow.domain.model.DecisionPoint;
import com.flamingo.ai.runbookflow.domain.model.Procedure;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Folds per-chunk concept graphs into one deduplicated graph.
 *
 * <p>Dedup keys:
 *
 * <ul>
 *   <li>principles and concept order: exact text
 *   <li>user types and issue categories: case-insensitive, first-seen casing wins
 *   <li>procedures: lowercase name, first occurrence wins
 *   <li>decision points: lowercase question with punctuation stripped and whitespace collapsed
 * </ul>
 *
 * <p>Display order follows first occurrence. The set of retained keys does not depend on the order
 * of the input graphs, and merging a graph with itself returns an equal graph.
 */
@Component
@Slf4j
public class ConceptGraphMerger {

  private static final Pattern PUNCTUATION = Pattern.compile("\\p{Punct}");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public ConceptGraph merge(List<ConceptGraph> graphs) {
    if (graphs == null || graphs.isEmpty()) {
      return ConceptGraph.empty();
    }

    Map<String, String> principles = new LinkedHashMap<>();
    Map<String, String> userTypes = new LinkedHashMap<>();
    Map<String, String> issueCategories = new LinkedHashMap<>();
    Map<String, Procedure> procedures = new LinkedHashMap<>();
    Map<String, DecisionPoint> decisionPoints = new LinkedHashMap<>();
    Map<String, String> conceptOrder = new LinkedHashMap<>();

    for (ConceptGraph graph : graphs) {
      if (graph == null) {
        continue;
      }
      addAll(principles, graph.principles(), Function.identity());
      addAll(userTypes, graph.userTypes(), ConceptGraphMerger::categoryKey);
      addAll(issueCategories, graph.issueCategories(), ConceptGraphMerger::categoryKey);
      for (Procedure procedure : graph.procedures()) {
        if (procedure != null && !isBlank(procedure.name())) {
          procedures.putIfAbsent(categoryKey(procedure.name()), procedure);
        }
      }
      for (DecisionPoint point : graph.decisionPoints()) {
        if (point != null && !isBlank(point.question())) {
          String key = questionKey(point.question());
          if (!key.isEmpty()) {
            decisionPoints.putIfAbsent(key, point);
          }
        }
      }
      addAll(conceptOrder, graph.conceptOrder(), Function.identity());
    }

    ConceptGraph merged =
        new ConceptGraph(
            new ArrayList<>(principles.values()),
            new ArrayList<>(userTypes.values()),
            new ArrayList<>(issueCategories.values()),
            new ArrayList<>(procedures.values()),
            new ArrayList<>(decisionPoints.values()),
            new ArrayList<>(conceptOrder.values()));

    log.debug(
        "Merged {} concept graphs: {} principles, {} user types, {} categories, {} procedures, "
            + "{} decision points, {} ordered concepts",
        graphs.size(),
        merged.principles().size(),
        merged.userTypes().size(),
        merged.issueCategories().size(),
        merged.procedures().size(),
        merged.decisionPoints().size(),
        merged.conceptOrder().size());
    return merged;
  }

  /** Lowercased, trimmed key used for categories and procedure names. */
  static String categoryKey(String value) {
    return value.trim().toLowerCase(Locale.ROOT);
  }

  /** Question key: lowercase, punctuation stripped, whitespace collapsed. */
  static String questionKey(String question) {
    String stripped = PUNCTUATION.matcher(question.toLowerCase(Locale.ROOT)).replaceAll("");
    return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
  }

  private static void addAll(
      Map<String, String> target, List<String> values, Function<String, String> keyFn) {
    for (String value : values) {
      if (!isBlank(value)) {
        target.putIfAbsent(keyFn.apply(value), value);
      }
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
