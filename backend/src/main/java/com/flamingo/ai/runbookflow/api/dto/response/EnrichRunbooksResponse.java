package com.flamingo.ai.runbookflow.api.dto.response;

import com.flamingo.ai.runbookflow.domain.model.Runbook;
import java.util.List;

/** Response DTO for runbook enrichment. Same order and size as the request. */
public record EnrichRunbooksResponse(List<Runbook> runbooks) {}
