package com.flamingo.ai.runbookflow.api.rest;

import com.flamingo.ai.runbookflow.api.dto.request.RegenerateNodeRequest;
import com.flamingo.ai.runbookflow.api.dto.response.RegeneratedNodeResponse;
import com.flamingo.ai.runbookflow.domain.enums.RegenerationMode;
import com.flamingo.ai.runbookflow.service.regeneration.NodeRegenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for single-node operations on a flowchart. */
@RestController
@RequestMapping("/api/nodes")
@RequiredArgsConstructor
@Slf4j
public class NodeController {

  private final NodeRegenerationService regenerationService;

  /**
   * Regenerates or expands one node.
   *
   * @param nodeId the node to rewrite
   * @param request the flowchart, optional feedback and mode
   * @return the new node and, for runbook nodes, its new runbook
   */
  @PostMapping("/{nodeId}/regenerate")
  public ResponseEntity<RegeneratedNodeResponse> regenerate(
      @PathVariable String nodeId, @Valid @RequestBody RegenerateNodeRequest request) {
    RegenerationMode mode =
        request.getMode() != null ? request.getMode() : RegenerationMode.REGENERATE;
    log.info("Regenerating node {} ({})", nodeId, mode.getValue());
    return ResponseEntity.ok(
        RegeneratedNodeResponse.fromResult(
            regenerationService.regenerate(
                request.getFlowchart(), nodeId, request.getFeedback(), mode)));
  }
}
