package com.flamingo.ai.runbookflow.service.repair;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.runbookflow.exception.RepairFailedException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort salvage of JSON that the oracle cut off mid-emission.
 *
 * <p>Strips code fences, then, when the text does not already end in a closing bracket, truncates
 * back to the last complete object and closes whatever is still open. The result is lossy and
 * advisory: callers keep their original data when {@link #parseArray} fails or returns a different
 * number of items than they sent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonRepair {

  private static final Pattern FENCE =
      Pattern.compile("^\\s*```[a-zA-Z]*\\s*\\n?(.*?)\\n?\\s*(```\\s*)?$", Pattern.DOTALL);

  private final ObjectMapper objectMapper;

  /**
   * Repairs possibly truncated JSON text. Never throws; input that cannot be improved is returned
   * as is (without code fences).
   */
  public static String repair(String text) {
    if (text == null) {
      return "";
    }
    String json = stripFences(text).trim();
    if (json.isEmpty() || json.endsWith("]") || json.endsWith("}")) {
      return json;
    }

    Deque<Character> stack = new ArrayDeque<>();
    boolean inString = false;
    boolean escaped = false;
    int lastTopLevelCut = -1;
    List<Character> lastTopLevelStack = null;
    int lastAnyCut = -1;
    List<Character> lastAnyStack = null;
    // Start of an object key still waiting for its colon
    int keyStart = -1;

    for (int i = 0; i < json.length(); i++) {
      char c = json.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      switch (c) {
        case '"' -> {
          inString = true;
          if (isKeyPosition(json, i, stack)) {
            keyStart = i;
          }
        }
        case ':' -> keyStart = -1;
        case '{', '[' -> stack.push(c);
        case '}', ']' -> {
          if (stack.isEmpty()) {
            continue;
          }
          stack.pop();
          if (c == '}') {
            lastAnyCut = i + 1;
            lastAnyStack = new ArrayList<>(stack);
            if (stack.size() == 1) {
              lastTopLevelCut = i + 1;
              lastTopLevelStack = new ArrayList<>(stack);
            }
          }
        }
        default -> {
          // other characters do not affect nesting
        }
      }
    }

    if (lastTopLevelCut > 0) {
      return close(json.substring(0, lastTopLevelCut), lastTopLevelStack);
    }
    if (lastAnyCut > 0) {
      return close(json.substring(0, lastAnyCut), lastAnyStack);
    }

    // Nothing complete to fall back on: close the dangling tail in place
    if (keyStart >= 0) {
      // A key without its value cannot be closed into valid JSON: drop it
      String head = json.substring(0, keyStart).stripTrailing();
      if (head.endsWith(",")) {
        head = head.substring(0, head.length() - 1);
      }
      return close(head, new ArrayList<>(stack));
    }
    StringBuilder tail = new StringBuilder(json);
    if (inString) {
      if (escaped) {
        tail.setLength(tail.length() - 1);
      }
      tail.append('"');
    }
    String trimmed = tail.toString().stripTrailing();
    if (trimmed.endsWith(",")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    } else if (trimmed.endsWith(":")) {
      trimmed = trimmed + "null";
    }
    return close(trimmed, new ArrayList<>(stack));
  }

  /**
   * Repairs the text and parses it as a JSON array.
   *
   * @throws RepairFailedException when the repaired text is not a JSON array
   */
  public List<JsonNode> parseArray(String text) {
    String repaired = repair(text);
    JsonNode root;
    try {
      root = objectMapper.readTree(repaired);
    } catch (JsonProcessingException e) {
      throw new RepairFailedException("Repaired output is not valid JSON", e);
    }
    if (root == null || !root.isArray()) {
      throw new RepairFailedException("Repaired output is not a JSON array");
    }
    List<JsonNode> items = new ArrayList<>();
    Iterator<JsonNode> elements = root.elements();
    elements.forEachRemaining(items::add);
    if (!repaired.equals(stripFences(text).trim())) {
      log.debug("Repaired truncated oracle output, salvaged {} items", items.size());
    }
    return items;
  }

  static String stripFences(String text) {
    Matcher matcher = FENCE.matcher(text);
    if (matcher.matches()) {
      return matcher.group(1);
    }
    return text;
  }

  /** True when the quote at {@code quote} opens a key of the innermost object. */
  private static boolean isKeyPosition(String json, int quote, Deque<Character> stack) {
    if (stack.isEmpty() || stack.peek() != '{') {
      return false;
    }
    for (int j = quote - 1; j >= 0; j--) {
      char prev = json.charAt(j);
      if (!Character.isWhitespace(prev)) {
        return prev == '{' || prev == ',';
      }
    }
    return false;
  }

  /** Appends closers for {@code open}, innermost first (stack order). */
  private static String close(String prefix, List<Character> open) {
    StringBuilder result = new StringBuilder(prefix);
    for (char opener : open) {
      result.append(opener == '{' ? '}' : ']');
    }
    return result.toString();
  }
}
