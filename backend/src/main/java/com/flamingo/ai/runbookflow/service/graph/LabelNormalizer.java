package com.flamingo.ai.runbookflow.service.graph;

import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rewrites terse question labels such as "MFA Issues" into questions ("Is this an MFA issue?").
 *
 * <p>Total and idempotent: labels already ending in {@code ?} are returned unchanged and every
 * rewritten label ends in {@code ?}.
 */
@Component
@Slf4j
public class LabelNormalizer {

  private static final List<String> CATEGORY_SUFFIXES =
      List.of(" issues", " request", " problem", " confusion");

  private static final Set<String> CUE_WORDS =
      Set.of("what", "which", "how", "who", "where", "when", "why");

  private static final List<String> AUXILIARY_PREFIXES = List.of("is ", "does ", "has ", "can ");

  private static final Set<String> TYPE_WORDS =
      Set.of("type", "types", "kind", "kinds", "category", "categories");

  /** Letters whose spoken name starts with a vowel sound, for acronyms. */
  private static final String VOWEL_SOUNDING_LETTERS = "AEFHILMNORSX";

  /** Normalizes the labels of all question nodes in place. Returns the number changed. */
  public int normalize(DecisionGraph graph) {
    int changed = 0;
    for (FlowNode node : graph.getNodes()) {
      if (node.getKind() != NodeKind.QUESTION) {
        continue;
      }
      String normalized = normalizeLabel(node.getLabel());
      if (normalized != null && !normalized.equals(node.getLabel())) {
        log.debug("Normalized label '{}' -> '{}'", node.getLabel(), normalized);
        node.setLabel(normalized);
        changed++;
      }
    }
    return changed;
  }

  public String normalizeLabel(String label) {
    if (label == null || label.isBlank()) {
      return label;
    }
    String trimmed = label.trim();
    if (trimmed.endsWith("?")) {
      return label;
    }

    String phrase = stripCategorySuffix(trimmed);
    if (phrase.isEmpty()) {
      return trimmed + "?";
    }

    String lowerLabel = trimmed.toLowerCase(Locale.ROOT);
    List<String> words = words(phrase);
    if (words.stream().anyMatch(CUE_WORDS::contains)
        || AUXILIARY_PREFIXES.stream().anyMatch(lowerLabel::startsWith)) {
      return phrase + "?";
    }
    if (words.stream().anyMatch(TYPE_WORDS::contains)) {
      return "What " + phrase + "?";
    }
    return "Is this " + article(phrase) + " " + phrase + " issue?";
  }

  private static String stripCategorySuffix(String label) {
    String lower = label.toLowerCase(Locale.ROOT);
    for (String suffix : CATEGORY_SUFFIXES) {
      if (lower.endsWith(suffix)) {
        return label.substring(0, label.length() - suffix.length()).trim();
      }
    }
    // Bare "Issues", "Request" and the like leave nothing to phrase
    for (String suffix : CATEGORY_SUFFIXES) {
      if (lower.equals(suffix.trim())) {
        return "";
      }
    }
    return label;
  }

  static String article(String phrase) {
    String firstWord = phrase.split("\\s+", 2)[0];
    char first = firstWord.charAt(0);
    if (isAcronym(firstWord)) {
      return VOWEL_SOUNDING_LETTERS.indexOf(Character.toUpperCase(first)) >= 0 ? "an" : "a";
    }
    return "aeiou".indexOf(Character.toLowerCase(first)) >= 0 ? "an" : "a";
  }

  private static boolean isAcronym(String word) {
    if (word.length() < 2) {
      return false;
    }
    for (int i = 0; i < word.length(); i++) {
      char c = word.charAt(i);
      if (Character.isLetter(c) && !Character.isUpperCase(c)) {
        return false;
      }
    }
    return Character.isLetter(word.charAt(0));
  }

  private static List<String> words(String phrase) {
    return List.of(phrase.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"));
  }
}
