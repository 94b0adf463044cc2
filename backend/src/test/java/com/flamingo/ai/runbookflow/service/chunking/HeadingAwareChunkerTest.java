package com.flamingo.ai.runbookflow.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.runbookflow.config.PipelineConfig;
import com.flamingo.ai.runbookflow.domain.model.Chunk;
import com.flamingo.ai.runbookflow.exception.ContentTooLargeException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HeadingAwareChunkerTest {

  private static final int BUDGET = 100; // tokens, 400 chars

  private HeadingAwareChunker chunker;

  @BeforeEach
  void setUp() {
    PipelineConfig config = new PipelineConfig();
    config.getChunking().setMaxChunks(10);
    config.getChunking().setCharsPerToken(4);
    chunker = new HeadingAwareChunker(config);
  }

  private static String section(int number, int bodyChars) {
    return "## Section " + number + "\n\n" + "x".repeat(bodyChars) + "\n";
  }

  @Nested
  @DisplayName("split")
  class Split {

    @Test
    @DisplayName("should return the whole text as one chunk when it fits the budget")
    void shouldReturnSingleChunk_whenTextFits() {
      String text = "# Login help\n\nAsk the user which browser they use.\n";

      List<Chunk> chunks = chunker.split(text, BUDGET);

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).text()).isEqualTo(text);
      assertThat(chunks.get(0).index()).isZero();
      assertThat(chunks.get(0).estimatedTokens()).isEqualTo(chunker.estimateTokens(text));
    }

    @Test
    @DisplayName("should cut at headings and re-prefix the preamble to every chunk")
    void shouldSplitAtHeadings_whenTextExceedsBudget() {
      StringBuilder text = new StringBuilder("Support runbook v2.\n");
      for (int i = 1; i <= 4; i++) {
        text.append(section(i, 220));
      }

      List<Chunk> chunks = chunker.split(text.toString(), BUDGET);

      assertThat(chunks).hasSizeGreaterThan(1);
      assertThat(chunks).allSatisfy(c -> assertThat(c.text()).startsWith("Support runbook v2."));
      assertThat(chunks)
          .allSatisfy(c -> assertThat(c.estimatedTokens()).isLessThanOrEqualTo(BUDGET));
      String all = chunks.stream().map(Chunk::text).collect(Collectors.joining("\n"));
      for (int i = 1; i <= 4; i++) {
        assertThat(countOccurrences(all, "## Section " + i + "\n")).isEqualTo(1);
      }
    }

    @Test
    @DisplayName("should pack consecutive small sections into one chunk")
    void shouldPackSections_whenSeveralFitTogether() {
      StringBuilder text = new StringBuilder();
      for (int i = 1; i <= 6; i++) {
        text.append(section(i, 100));
      }

      List<Chunk> chunks = chunker.split(text.toString(), BUDGET);

      assertThat(chunks).hasSizeLessThan(6);
      assertThat(chunks.get(0).text()).contains("## Section 1").contains("## Section 2");
    }

    @Test
    @DisplayName("should not split at heading markers inside code fences")
    void shouldIgnoreHeadings_whenInsideCodeFence() {
      String text =
          "## Real section\n\n```\n## not a heading\n"
              + "y".repeat(300)
              + "\n```\n"
              + section(2, 300);

      List<Chunk> chunks = chunker.split(text, BUDGET);

      assertThat(chunks.stream().filter(c -> c.text().startsWith("## not a heading"))).isEmpty();
      assertThat(chunks.get(0).text()).startsWith("## Real section");
    }

    @Test
    @DisplayName("should hard-split by size when there are no headings")
    void shouldHardSplit_whenNoHeadings() {
      List<String> lines = new ArrayList<>();
      for (int i = 0; i < 40; i++) {
        lines.add("Step " + i + ": restart the sync agent and check the logs.");
      }
      String text = String.join("\n", lines);

      List<Chunk> chunks = chunker.split(text, BUDGET);

      assertThat(chunks).hasSizeGreaterThan(1);
      assertThat(chunks.stream().map(Chunk::text).collect(Collectors.joining())).isEqualTo(text);
      assertThat(chunks).allSatisfy(c -> assertThat(c.text().length()).isLessThanOrEqualTo(400));
    }

    @Test
    @DisplayName("should hard-split a single section that exceeds the budget")
    void shouldHardSplitSection_whenSectionExceedsBudget() {
      String text = "Preamble.\n" + section(1, 1000) + section(2, 50);

      List<Chunk> chunks = chunker.split(text, BUDGET);

      assertThat(chunks).hasSizeGreaterThanOrEqualTo(3);
      assertThat(chunks).allSatisfy(c -> assertThat(c.text()).startsWith("Preamble."));
      assertThat(chunks).allSatisfy(c -> assertThat(c.text().length()).isLessThanOrEqualTo(400));
      assertThat(chunks.get(chunks.size() - 1).text()).contains("## Section 2");
    }

    @Test
    @DisplayName("should number chunks from zero in order")
    void shouldIndexChunksInOrder() {
      StringBuilder text = new StringBuilder();
      for (int i = 1; i <= 3; i++) {
        text.append(section(i, 300));
      }

      List<Chunk> chunks = chunker.split(text.toString(), BUDGET);

      for (int i = 0; i < chunks.size(); i++) {
        assertThat(chunks.get(i).index()).isEqualTo(i);
      }
    }
  }

  @Nested
  @DisplayName("validateSize")
  class ValidateSize {

    @Test
    @DisplayName("should reject content needing more chunks than the ceiling")
    void shouldThrow_whenChunksNeededExceedCeiling() {
      String text = "a".repeat(BUDGET * 4 * 10 + 4);

      assertThatThrownBy(() -> chunker.validateSize(text, BUDGET))
          .isInstanceOf(ContentTooLargeException.class)
          .satisfies(
              e -> {
                ContentTooLargeException ex = (ContentTooLargeException) e;
                assertThat(ex.getChunksNeeded()).isEqualTo(11);
                assertThat(ex.getMaxChunks()).isEqualTo(10);
              });
    }

    @Test
    @DisplayName("should accept content at exactly the ceiling")
    void shouldAccept_whenChunksNeededEqualCeiling() {
      String text = "a".repeat(BUDGET * 4 * 10);

      assertThatCode(() -> chunker.validateSize(text, BUDGET)).doesNotThrowAnyException();
    }
  }

  @Test
  @DisplayName("should estimate tokens as ceil(length / 4)")
  void shouldEstimateTokensConservatively() {
    assertThat(chunker.estimateTokens("")).isZero();
    assertThat(chunker.estimateTokens("abcd")).isEqualTo(1);
    assertThat(chunker.estimateTokens("abcde")).isEqualTo(2);
  }

  @Test
  @DisplayName("hardSplit should prefer line breaks and preserve the text")
  void shouldPreferLineBreaks_whenHardSplitting() {
    String text = "a".repeat(30) + "\n" + "b".repeat(30);

    List<String> parts = HeadingAwareChunker.hardSplit(text, 40);

    assertThat(parts).containsExactly("a".repeat(30) + "\n", "b".repeat(30));
  }

  private static int countOccurrences(String text, String needle) {
    int count = 0;
    for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
      count++;
    }
    return count;
  }
}
