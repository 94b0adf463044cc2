package com.flamingo.ai.runbookflow.exception;

/** Exception thrown when a node id is not part of the submitted graph. */
public class NodeNotFoundException extends RuntimeException {

  private final String nodeId;

  public NodeNotFoundException(String nodeId) {
    super("Node not found: " + nodeId);
    this.nodeId = nodeId;
  }

  public String getNodeId() {
    return nodeId;
  }
}
