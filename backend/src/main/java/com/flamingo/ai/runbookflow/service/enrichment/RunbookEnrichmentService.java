package com.flamingo.ai.runbookflow.service.enrichment;

import com.flamingo.ai.runbookflow.domain.model.Runbook;
import java.util.List;

/** Adds export-ready detail to runbooks in batches. */
public interface RunbookEnrichmentService {

  /**
   * Enriches runbooks. Never fails: any runbook the oracle could not enrich is returned unchanged.
   *
   * @param runbooks runbooks to enrich
   * @return runbooks in the same order and of the same size
   */
  List<Runbook> enrich(List<Runbook> runbooks);
}
