package com.flamingo.ai.runbookflow.domain.model;

import java.util.List;

/** A procedure named in the source document, as extracted by the oracle. */
public record Procedure(
    String name, List<String> prerequisites, List<String> steps, List<String> outcomes) {

  public Procedure {
    prerequisites = ConceptGraph.withoutNulls(prerequisites);
    steps = ConceptGraph.withoutNulls(steps);
    outcomes = ConceptGraph.withoutNulls(outcomes);
  }
}
