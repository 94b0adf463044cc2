package com.flamingo.ai.runbookflow.api.rest;

import com.flamingo.ai.runbookflow.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.runbookflow.api.dto.response.AnalysisResponse;
import com.flamingo.ai.runbookflow.service.analysis.AnalysisService;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for blocking runbook analysis. */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

  private final AnalysisService analysisService;

  /**
   * Analyzes a runbook and returns the laid-out decision graph.
   *
   * @param request the runbook to analyze
   * @return the graph with its summary
   */
  @PostMapping
  public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
    AnalysisResult result = analysisService.analyze(request.getMarkdown());
    return ResponseEntity.ok(AnalysisResponse.fromResult(result));
  }
}
