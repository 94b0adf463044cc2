package com.flamingo.ai.runbookflow.service.chunking;

import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.exception.ContentTooLargeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that produces chunks aligned to top-level Markdown headings.
 *
 * <p>Text that fits the budget is returned unchanged as one chunk. Otherwise the preamble before
 * the first heading is set aside and the rest is cut at level 1-2 headings. Consecutive sections
 * are packed greedily into a chunk until the next one would exceed the budget; every chunk starts
 * with the preamble. A section that alone exceeds the budget is hard-split by character count.
 * Text without any heading is split by character count only.
 *
 * <p>Headings are located with commonmark source spans, so {@code #} lines inside fenced code
 * blocks never start a section.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HeadingAwareChunker implements DocumentChunker {

  static final String SEPARATOR = "\n\n";

  private static final int MAX_SPLIT_LEVEL = 2;

  private static final Parser PARSER =
      Parser.builder().includeSourceSpans(IncludeSourceSpans.BLOCKS).build();

  private final PipelineConfig pipelineConfig;

  @Override
  public void validateSize(String text, int maxTokensPerChunk) {
    int tokens = estimateTokens(text);
    int chunksNeeded = (int) Math.ceil((double) tokens / maxTokensPerChunk);
    int maxChunks = pipelineConfig.getChunking().getMaxChunks();
    if (chunksNeeded > maxChunks) {
      log.warn(
          "Rejecting content of ~{} tokens: needs {} chunks, limit {}",
          tokens,
          chunksNeeded,
          maxChunks);
      throw new ContentTooLargeException(chunksNeeded, maxChunks);
    }
  }

  @Override
  public List<Chunk> split(String text, int maxTokensPerChunk) {
    if (maxTokensPerChunk <= 0) {
      throw new IllegalArgumentException("maxTokensPerChunk must be positive");
    }
    String content = text != null ? text : "";
    if (estimateTokens(content) <= maxTokensPerChunk) {
      return List.of(new Chunk(0, content, estimateTokens(content)));
    }

    int maxChars = maxTokensPerChunk * pipelineConfig.getChunking().getCharsPerToken();
    List<String> pieces;

    String[] lines = content.split("\n", -1);
    List<Integer> headingLines = findSplitHeadings(content);
    if (headingLines.isEmpty()) {
      log.debug("No level 1-2 headings found, splitting {} chars by size", content.length());
      pieces = hardSplit(content, maxChars);
    } else {
      String preamble = joinLines(lines, 0, headingLines.get(0));
      List<String> sections = new ArrayList<>();
      for (int i = 0; i < headingLines.size(); i++) {
        int end = i + 1 < headingLines.size() ? headingLines.get(i + 1) : lines.length;
        sections.add(joinLines(lines, headingLines.get(i), end));
      }
      if (!preamble.isBlank() && estimateTokens(preamble) > maxTokensPerChunk / 2) {
        // too large to repeat in every chunk
        sections.add(0, preamble);
        preamble = "";
      }
      pieces = pack(preamble.isBlank() ? "" : preamble, sections, maxTokensPerChunk, maxChars);
    }

    List<Chunk> chunks = new ArrayList<>();
    for (String piece : pieces) {
      chunks.add(new Chunk(chunks.size(), piece, estimateTokens(piece)));
    }

    int maxChunks = pipelineConfig.getChunking().getMaxChunks();
    if (chunks.size() > maxChunks) {
      throw new ContentTooLargeException(chunks.size(), maxChunks);
    }

    log.debug(
        "HeadingAwareChunker produced {} chunks from {} chars ({} headings)",
        chunks.size(),
        content.length(),
        headingLines.size());
    return chunks;
  }

  @Override
  public int estimateTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    int charsPerToken = pipelineConfig.getChunking().getCharsPerToken();
    return (text.length() + charsPerToken - 1) / charsPerToken;
  }

  // ---- heading detection ----

  /** Zero-based line indices of top-level headings of level 1 or 2, in document order. */
  private List<Integer> findSplitHeadings(String content) {
    Node document = PARSER.parse(content);
    List<Integer> result = new ArrayList<>();
    for (Node node = document.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof Heading heading && heading.getLevel() <= MAX_SPLIT_LEVEL) {
        List<SourceSpan> spans = heading.getSourceSpans();
        if (!spans.isEmpty()) {
          result.add(spans.get(0).getLineIndex());
        }
      }
    }
    return result;
  }

  private String joinLines(String[] lines, int from, int to) {
    return String.join("\n", Arrays.asList(lines).subList(from, to));
  }

  // ---- packing ----

  private List<String> pack(
      String preamble, List<String> sections, int maxTokensPerChunk, int maxChars) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder(preamble);
    boolean currentHasSection = false;

    for (String section : sections) {
      String candidate = current.length() > 0 ? current + SEPARATOR + section : section;
      if (estimateTokens(candidate) <= maxTokensPerChunk) {
        current = new StringBuilder(candidate);
        currentHasSection = true;
        continue;
      }

      if (currentHasSection) {
        pieces.add(current.toString());
        current = new StringBuilder(preamble);
        currentHasSection = false;
        candidate = current.length() > 0 ? current + SEPARATOR + section : section;
        if (estimateTokens(candidate) <= maxTokensPerChunk) {
          current = new StringBuilder(candidate);
          currentHasSection = true;
          continue;
        }
      }

      // Single section over budget: hard split, each part re-prefixed with the preamble
      int prefixChars = preamble.isEmpty() ? 0 : preamble.length() + SEPARATOR.length();
      log.debug("Section of {} chars exceeds budget, hard-splitting", section.length());
      for (String part : hardSplit(section, Math.max(1, maxChars - prefixChars))) {
        pieces.add(preamble.isEmpty() ? part : preamble + SEPARATOR + part);
      }
      current = new StringBuilder(preamble);
      currentHasSection = false;
    }

    if (currentHasSection) {
      pieces.add(current.toString());
    }
    return pieces;
  }

  /**
   * Splits by character count. A cut moves back to the last line break in the second half of the
   * window when there is one. Concatenating the parts gives back the input.
   */
  static List<String> hardSplit(String text, int maxChars) {
    List<String> parts = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + maxChars, text.length());
      if (end < text.length()) {
        int lineBreak = text.lastIndexOf('\n', end - 1);
        if (lineBreak >= start + maxChars / 2) {
          end = lineBreak + 1;
        }
      }
      parts.add(text.substring(start, end));
      start = end;
    }
    return parts;
  }
}
