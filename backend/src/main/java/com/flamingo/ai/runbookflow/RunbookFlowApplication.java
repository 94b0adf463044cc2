package com.flamingo.ai.runbookflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Runbook-to-flowchart analysis service. */
@SpringBootApplication
public class RunbookFlowApplication {

  public static void main(String[] args) {
    SpringApplication.run(RunbookFlowApplication.class, args);
  }
}
