package com.flamingo.ai.runbookflow.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.agent.dto.RunbookPayload;
import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.model.Runbook;
import com.flamingo.ai.runbookflow.exception.OracleCallException;
import com.flamingo.ai.runbookflow.exception.RepairFailedException;
import com.flamingo.ai.runbookflow.service.graph.DecisionGraphMapper;
import com.flamingo.ai.runbookflow.service.oracle.OracleClient;
import com.flamingo.ai.runbookflow.service.repair.JsonRepair;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of {@link RunbookEnrichmentService}.
 *
 * <p>Each batch is one free-text oracle call whose output is repaired by {@link JsonRepair}. A
 * batch that cannot be parsed, or whose item count differs from what was sent, keeps all its
 * original runbooks. Within a usable batch, an item with a different id or without title or steps
 * keeps its original.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunbookEnrichmentServiceImpl implements RunbookEnrichmentService {

  private final OracleClient oracleClient;
  private final JsonRepair jsonRepair;
  private final DecisionGraphMapper mapper;
  private final ObjectMapper objectMapper;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "enrichment.runbooks", description = "Time to enrich runbooks")
  public List<Runbook> enrich(List<Runbook> runbooks) {
    if (runbooks == null || runbooks.isEmpty()) {
      return List.of();
    }
    int batchSize = Math.max(1, pipelineConfig.getEnrichment().getBatchSize());
    List<Runbook> result = new ArrayList<>(runbooks.size());
    int enriched = 0;

    for (int start = 0; start < runbooks.size(); start += batchSize) {
      List<Runbook> batch = runbooks.subList(start, Math.min(start + batchSize, runbooks.size()));
      List<Runbook> processed = enrichBatch(batch, start / batchSize + 1);
      for (int i = 0; i < batch.size(); i++) {
        if (processed.get(i) != batch.get(i)) {
          enriched++;
        }
      }
      result.addAll(processed);
    }

    log.info("Enriched {} of {} runbooks", enriched, runbooks.size());
    meterRegistry.counter("enrichment.runbooks.enriched").increment(enriched);
    meterRegistry
        .counter("enrichment.runbooks.kept_original")
        .increment(runbooks.size() - enriched);
    return result;
  }

  private List<Runbook> enrichBatch(List<Runbook> batch, int batchNumber) {
    List<JsonNode> items;
    try {
      String json = objectMapper.writeValueAsString(batch);
      String output = oracleClient.enrichRunbooks(batch.size(), json);
      items = jsonRepair.parseArray(output);
    } catch (OracleCallException | RepairFailedException | JsonProcessingException e) {
      log.warn("Batch {} not enriched, keeping originals: {}", batchNumber, e.getMessage());
      return batch;
    }

    if (items.size() != batch.size()) {
      log.warn(
          "Batch {} returned {} runbooks for {} sent, keeping originals",
          batchNumber,
          items.size(),
          batch.size());
      return batch;
    }

    List<Runbook> processed = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      processed.add(mergeItem(batch.get(i), items.get(i)));
    }
    return processed;
  }

  private Runbook mergeItem(Runbook original, JsonNode item) {
    RunbookPayload payload;
    try {
      payload = objectMapper.treeToValue(item, RunbookPayload.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.debug("Runbook {} came back unreadable: {}", original.id(), e.getMessage());
      return original;
    }
    if (payload == null
        || !Objects.equals(original.id(), payload.id())
        || payload.title() == null
        || payload.title().isBlank()
        || payload.steps() == null
        || payload.steps().isEmpty()) {
      log.debug("Runbook {} came back incomplete, keeping original", original.id());
      return original;
    }
    Runbook enriched = mapper.toRunbook(payload);
    return enriched.steps().isEmpty() ? original : enriched;
  }
}
