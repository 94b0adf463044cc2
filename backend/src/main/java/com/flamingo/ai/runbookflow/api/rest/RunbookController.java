package com.flamingo.ai.runbookflow.api.rest;

import com.flamingo.ai.runbookflow.api.dto.request.EnrichRunbooksRequest;
import com.flamingo.ai.runbookflow.api.dto.response.EnrichRunbooksResponse;
import com.flamingo.ai.runbookflow.service.enrichment.RunbookEnrichmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for runbook operations. */
@RestController
@RequestMapping("/api/runbooks")
@RequiredArgsConstructor
@Slf4j
public class RunbookController {

  private final RunbookEnrichmentService enrichmentService;

  /**
   * Enriches runbooks for export. Runbooks that could not be enriched come back unchanged.
   *
   * @param request the runbooks
   * @return the runbooks, in request order
   */
  @PostMapping("/enrich")
  public ResponseEntity<EnrichRunbooksResponse> enrich(
      @Valid @RequestBody EnrichRunbooksRequest request) {
    log.info("Enriching {} runbooks", request.getRunbooks().size());
    return ResponseEntity.ok(
        new EnrichRunbooksResponse(enrichmentService.enrich(request.getRunbooks())));
  }
}
