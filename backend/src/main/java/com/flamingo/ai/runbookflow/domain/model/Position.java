package com.flamingo.ai.runbookflow.domain.model;

/** Node centre in the synthetic layout coordinate space. */
public record Position(double x, double y) {

  public static final Position ORIGIN = new Position(0, 0);
}
