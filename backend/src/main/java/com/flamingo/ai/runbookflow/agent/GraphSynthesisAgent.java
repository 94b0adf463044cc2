package com.flamingo.ai.runbookflow.agent;

import com.flamingo.ai.runbookflow.agent.dto.GraphGenerationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that turns a concept graph and its source runbook into a hierarchical decision graph.
 *
 * <p>The prompt states the structural rules the critic later re-verifies: categorical splits never
 * re-merge, every question branches through answer nodes, and every node is reachable and has an
 * exit unless it is terminal.
 */
public interface GraphSynthesisAgent {

  String GRAPH_RULES =
      """
        ## STRUCTURAL RULES (mandatory)

        1. CATEGORICAL SPLITS NEVER RE-MERGE. Once a question splits by mutually exclusive type
           (user type, issue category, subsystem), the subtrees below different answers must not
           share any question or answer node. Duplicate the follow-up nodes per branch instead.
        2. ANSWERS ARE NODES. Every edge leaving a question goes to an "answer" node whose label
           is the answer text. An answer node then leads to the next question, a runbook node or
           an end node. Never connect a question directly to another question.
        3. EVERYTHING IS CONNECTED. Every node except "start" has at least one incoming edge.
           Every node except "end" and "runbook" nodes has at least one outgoing edge.
        4. HIERARCHY. Ask the most fundamental question first. Each child question must only make
           sense given its parent's answer. Never ask the same question in several branches;
           move it above the split instead. Prefer depth over breadth.
        5. RUNBOOKS are linear: numbered steps, no conditional branching. Every runbook node has
           a "runbookId" that matches a runbook in "runbooks".
        6. Every question node has a "sourceRef" with the exact quote, its section, and why it
           led to the question. End nodes carry "endStateType": resolved, escalate, manual or
           blocked.
        """;

  String OUTPUT_FORMAT =
      """
        Return a JSON object with this exact structure:
        {
          "reasoning": "How you decomposed the runbook",
          "flowchart": {
            "nodes": [
              {"id": "start", "type": "start", "label": "Start", "description": "Entry point"},
              {"id": "q1", "type": "question", "label": "User type?",
               "question": "What type of user is affected?", "description": "...",
               "sourceRef": {"quote": "...", "section": "...", "reasoning": "..."}},
              {"id": "a1", "type": "answer", "label": "Provider"},
              {"id": "rb1", "type": "runbook", "label": "Reset provider MFA",
               "runbookId": "runbook-1"},
              {"id": "end-resolved", "type": "end", "label": "Issue Resolved",
               "endStateType": "resolved"}
            ],
            "edges": [
              {"id": "e1", "source": "start", "target": "q1", "label": ""},
              {"id": "e2", "source": "q1", "target": "a1", "label": "Provider"}
            ],
            "runbooks": [
              {"id": "runbook-1", "title": "...", "description": "When to use this runbook",
               "prerequisites": ["..."],
               "steps": [{"order": 1, "instruction": "...", "details": "...",
                          "warning": "...", "toolsRequired": ["..."]}],
               "notes": ["..."], "relatedRunbookIds": [],
               "sourceRef": {"quote": "...", "section": "...", "reasoning": "..."}}
            ],
            "metadata": {"title": "...", "description": "...", "version": "1.0"}
          }
        }
        Generate unique ids for all nodes and edges. Return ONLY valid JSON.
        """;

  @SystemMessage(
      """
        You are an expert at analyzing complex technical runbooks and creating HIERARCHICAL
        decision trees where questions build on each other and branch logically. The test of a
        good tree is that each answer meaningfully changes which questions come next.
        """)
  @UserMessage(
      """
        {{rules}}

        ## CONCEPT GRAPH (extracted from the runbook, concepts in dependency order)

        {{conceptGraph}}

        ## RUNBOOK

        {{content}}

        ## TASK

        1. Identify the dimensions of variability (user types, issue categories, subsystems).
        2. Put the most fundamental dimension at the top.
        3. Build the tree top-down following the structural rules.

        {{outputFormat}}
        """)
  GraphGenerationResult synthesize(
      @V("rules") String rules,
      @V("conceptGraph") String conceptGraph,
      @V("content") String content,
      @V("outputFormat") String outputFormat);
}
