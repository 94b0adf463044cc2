package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;

/**
 * Domain concepts of a runbook in dependency order, prior to graph synthesis.
 *
 * <p>Produced once per chunk by extraction and folded into a single merged instance by {@link
 * com.flamingo.ai.runbookflow.service.concept.ConceptGraphMerger}. All lists are immutable.
 *
 * @param principles guiding principles, deduplicated by exact text
 * @param userTypes user types, deduplicated case-insensitively
 * @param issueCategories issue categories, deduplicated case-insensitively
 * @param procedures procedures, deduplicated by lowercase name
 * @param decisionPoints decision points, deduplicated by normalized question
 * @param conceptOrder concept names in dependency order
 */
public record ConceptGraph(
    List<String> principles,
    List<String> userTypes,
    List<String> issueCategories,
    List<Procedure> procedures,
    List<DecisionPoint> decisionPoints,
    List<String> conceptOrder) {

  public ConceptGraph {
    principles = withoutNulls(principles);
    userTypes = withoutNulls(userTypes);
    issueCategories = withoutNulls(issueCategories);
    procedures = withoutNulls(procedures);
    decisionPoints = withoutNulls(decisionPoints);
    conceptOrder = withoutNulls(conceptOrder);
  }

  /** Immutable copy of {@code list} without {@code null} elements; empty when absent. */
  static <T> List<T> withoutNulls(List<T> list) {
    return list == null ? List.of() : list.stream().filter(Objects::nonNull).toList();
  }

  public static ConceptGraph empty() {
    return new ConceptGraph(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return principles.isEmpty()
        && userTypes.isEmpty()
        && issueCategories.isEmpty()
        && procedures.isEmpty()
        && decisionPoints.isEmpty()
        && conceptOrder.isEmpty();
  }
}
