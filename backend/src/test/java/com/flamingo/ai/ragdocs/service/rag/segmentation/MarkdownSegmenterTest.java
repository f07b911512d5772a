package com.flamingo.ai.ragdocs.service.rag.segmentation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.ragdocs.config.RagConfig;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownSegmenter Tests")
class MarkdownSegmenterTest {

  private RagConfig ragConfig;
  private MarkdownSegmenter segmenter;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    segmenter = newSegmenter();
  }

  private MarkdownSegmenter newSegmenter() {
    return new MarkdownSegmenter(
        new FrontmatterExtractor(),
        new CodeBlockNormalizer(),
        new CategoryClassifier(ragConfig),
        ragConfig);
  }

  @Nested
  @DisplayName("Section extraction")
  class SectionExtraction {

    @Test
    @DisplayName("Should start a section at every header and include the header line")
    void shouldSplitAtHeaders() {
      String text = "## Install\nRun the installer.\n## Configure\nEdit the file.\n";

      List<MarkdownSection> sections = segmenter.extractSections(text);

      assertThat(sections).hasSize(2);
      assertThat(sections.get(0).title()).isEqualTo("Install");
      assertThat(sections.get(0).level()).isEqualTo(2);
      assertThat(sections.get(0).content()).isEqualTo("## Install\nRun the installer.\n");
      assertThat(sections.get(1).title()).isEqualTo("Configure");
      assertThat(sections.get(1).content()).isEqualTo("## Configure\nEdit the file.\n");
    }

    @Test
    @DisplayName("Should treat text without headers as one untitled section")
    void shouldReturnUntitledSectionWithoutHeaders() {
      List<MarkdownSection> sections = segmenter.extractSections("Just prose.\nMore prose.");

      assertThat(sections)
          .singleElement()
          .satisfies(
              s -> {
                assertThat(s.title()).isEqualTo(MarkdownSegmenter.UNTITLED);
                assertThat(s.level()).isZero();
              });
    }

    @Test
    @DisplayName("Should keep text before the first header as an untitled section")
    void shouldKeepPreamble() {
      List<MarkdownSection> sections = segmenter.extractSections("Intro line\n# Title\nBody");

      assertThat(sections)
          .extracting(MarkdownSection::title)
          .containsExactly(MarkdownSegmenter.UNTITLED, "Title");
      assertThat(sections.get(0).level()).isZero();
      assertThat(sections.get(1).level()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cover the whole text with contiguous spans")
    void shouldCoverWholeText() {
      String text =
          "Preface\n# One\nalpha\n## Two\nbeta\n###### Six\ngamma\n#not-a-header\n### Three ###\n";

      List<MarkdownSection> sections = segmenter.extractSections(text);

      assertThat(sections.stream().map(MarkdownSection::content).collect(Collectors.joining()))
          .isEqualTo(text);
      for (int i = 1; i < sections.size(); i++) {
        assertThat(sections.get(i).startOffset()).isEqualTo(sections.get(i - 1).endOffset());
      }
      assertThat(sections.get(0).startOffset()).isZero();
      assertThat(sections.get(sections.size() - 1).endOffset()).isEqualTo(text.length());
      assertThat(sections)
          .extracting(MarkdownSection::title)
          .containsExactly(MarkdownSegmenter.UNTITLED, "One", "Two", "Six", "Three");
    }

    @Test
    @DisplayName("Should not treat seven hashes or a missing space as a header")
    void shouldIgnoreInvalidHeaders() {
      List<MarkdownSection> sections =
          segmenter.extractSections("####### too deep\n#hashtag\ntext");

      assertThat(sections).hasSize(1);
      assertThat(sections.get(0).level()).isZero();
    }

    @Test
    @DisplayName("Should not split at setext headings")
    void shouldIgnoreSetextHeadings() {
      List<MarkdownSection> sections =
          segmenter.extractSections("Overview\n========\ntext\nDetails\n-------\nmore");

      assertThat(sections)
          .singleElement()
          .satisfies(s -> assertThat(s.title()).isEqualTo(MarkdownSegmenter.UNTITLED));
    }

    @Test
    @DisplayName("Should not split at headings nested in a block quote")
    void shouldIgnoreQuotedHeadings() {
      List<MarkdownSection> sections =
          segmenter.extractSections("# Notes\n> # Quoted\n> still quoted\nafter");

      assertThat(sections).extracting(MarkdownSection::title).containsExactly("Notes");
      assertThat(sections.get(0).content()).contains("> # Quoted");
    }

    @Test
    @DisplayName("Should take the heading title as plain text without inline markup")
    void shouldStripInlineMarkupFromTitle() {
      List<MarkdownSection> sections =
          segmenter.extractSections("## Using `kubectl` *safely*\nbody");

      assertThat(sections.get(0).title()).isEqualTo("Using kubectl safely");
      assertThat(sections.get(0).level()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Processing")
  class Processing {

    @Test
    @DisplayName("Should produce one candidate per non-blank section")
    void shouldProduceCandidates() {
      SegmentedDocument document =
          segmenter.process("## Install\nRun it.\n\n## Security\nEnable TLS encryption.\n");

      assertThat(document.sections())
          .extracting(SectionCandidate::title)
          .containsExactly("Install", "Security");
      assertThat(document.sections().get(1).content())
          .isEqualTo("## Security\nEnable TLS encryption.");
    }

    @Test
    @DisplayName("Should drop blank preamble sections")
    void shouldDropBlankSections() {
      SegmentedDocument document = segmenter.process("\n\n# Title\nBody");

      assertThat(document.sections())
          .singleElement()
          .extracting(SectionCandidate::title)
          .isEqualTo("Title");
    }

    @Test
    @DisplayName("Should strip frontmatter and expose its metadata")
    void shouldExtractFrontmatter() {
      SegmentedDocument document =
          segmenter.process("---\ntitle: Guide\nindent:\n    nested: true\n---\n# Body\ntext");

      assertThat(document.frontmatter()).containsEntry("title", "Guide");
      assertThat(document.sections())
          .singleElement()
          .satisfies(s -> assertThat(s.content()).isEqualTo("# Body\ntext"));
    }

    @Test
    @DisplayName("Should keep malformed frontmatter as content")
    void shouldKeepMalformedFrontmatter() {
      SegmentedDocument document = segmenter.process("---\nkey: [oops\n---\nBody text");

      assertThat(document.frontmatter()).isEmpty();
      assertThat(document.sections())
          .singleElement()
          .satisfies(s -> assertThat(s.content()).contains("key: [oops", "Body text"));
    }

    @Test
    @DisplayName("Should replace code before splitting so code comments are not headers")
    void shouldNormalizeCodeBeforeSplitting() {
      SegmentedDocument document =
          segmenter.process("# Setup\n```bash\n# install deps\npip install x\n```\nDone");

      assertThat(document.sections())
          .singleElement()
          .satisfies(
              s ->
                  assertThat(s.content())
                      .isEqualTo("# Setup\n[CODE_BLOCK_bash: Code example]\nDone"));
    }

    @Test
    @DisplayName("Should normalize Windows line endings")
    void shouldNormalizeCrlf() {
      SegmentedDocument document = segmenter.process("# A\r\none\r\n# B\r\ntwo");

      assertThat(document.sections()).extracting(SectionCandidate::title).containsExactly("A", "B");
      assertThat(document.sections().get(0).content()).isEqualTo("# A\none");
    }

    @Test
    @DisplayName("Should normalize lone carriage returns")
    void shouldNormalizeLoneCr() {
      SegmentedDocument document = segmenter.process("# A\rone\r# B\rtwo");

      assertThat(document.sections()).extracting(SectionCandidate::title).containsExactly("A", "B");
      assertThat(document.sections().get(1).content()).isEqualTo("# B\ntwo");
    }

    @Test
    @DisplayName("Should bound title and content lengths")
    void shouldBoundLengths() {
      ragConfig.getSegmentation().setMaxTitleLength(12);
      ragConfig.getSegmentation().setMaxContentLength(40);
      MarkdownSegmenter bounded = newSegmenter();

      SegmentedDocument document =
          bounded.process(
              "# A rather long section title\n"
                  + "This body is clearly longer than forty characters in total.");

      SectionCandidate section = document.sections().get(0);
      assertThat(section.title()).isEqualTo("A rather...");
      assertThat(section.content().length()).isLessThanOrEqualTo(40);
      assertThat(section.content()).endsWith(TextTruncator.ELLIPSIS);
    }

    @Test
    @DisplayName("Should handle empty input")
    void shouldHandleEmptyInput() {
      assertThat(segmenter.process("").sections()).isEmpty();
      assertThat(segmenter.process(null).sections()).isEmpty();
    }

    @Test
    @DisplayName("Should classify through the category classifier")
    void shouldClassify() {
      assertThat(segmenter.classify("Tune throughput and latency", "Performance"))
          .isEqualTo("performance");
    }
  }
}
