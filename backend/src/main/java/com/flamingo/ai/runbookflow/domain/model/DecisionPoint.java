package com.flamingo.ai.runbookflow.domain.model;

import java.util.List;

/** A question the support person has to answer, and what it depends on and determines. */
public record DecisionPoint(String question, List<String> dependsOn, List<String> determines) {

  public DecisionPoint {
    dependsOn = ConceptGraph.withoutNulls(dependsOn);
    determines = ConceptGraph.withoutNulls(determines);
  }
}
