package com.flamingo.ai.ragdocs.service.rag.segmentation;

import com.flamingo.ai.ragdocs.config.RagConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.Text;
import org.springframework.stereotype.Service;

/**
 * Turns a raw markdown document into ordered, size-bounded sections.
 *
 * <p>Pipeline: line endings are normalized, the frontmatter block is taken off, code is replaced
 * by placeholders, then the text is split at ATX headers ({@code #} to {@code ######}) found by
 * commonmark. Only top-level headings written at the start of a line count; setext headings and
 * headings nested in lists or quotes do not. Each header opens a section that runs to the next
 * header, header line included. Text before the first header (or the whole text when there are no
 * headers) is an untitled level-0 section.
 */
@Service
@Slf4j
public class MarkdownSegmenter {

  public static final String UNTITLED = "Main Content";

  private final FrontmatterExtractor frontmatterExtractor;
  private final CodeBlockNormalizer codeBlockNormalizer;
  private final CategoryClassifier categoryClassifier;
  private final int maxTitleLength;
  private final int maxContentLength;

  public MarkdownSegmenter(
      FrontmatterExtractor frontmatterExtractor,
      CodeBlockNormalizer codeBlockNormalizer,
      CategoryClassifier categoryClassifier,
      RagConfig ragConfig) {
    this.frontmatterExtractor = frontmatterExtractor;
    this.codeBlockNormalizer = codeBlockNormalizer;
    this.categoryClassifier = categoryClassifier;
    this.maxTitleLength = ragConfig.getSegmentation().getMaxTitleLength();
    this.maxContentLength = ragConfig.getSegmentation().getMaxContentLength();
  }

  /**
   * Segments a markdown document.
   *
   * @param rawText the file content
   * @return frontmatter plus non-blank bounded sections in document order
   */
  public SegmentedDocument process(String rawText) {
    String text = rawText == null ? "" : rawText.replace("\r\n", "\n").replace('\r', '\n');
    ExtractedFrontmatter frontmatter = frontmatterExtractor.extract(text);
    String body = codeBlockNormalizer.normalize(frontmatter.body());

    List<SectionCandidate> candidates = new ArrayList<>();
    for (MarkdownSection section : extractSections(body)) {
      String content = section.content().strip();
      if (content.isEmpty()) {
        continue;
      }
      candidates.add(
          new SectionCandidate(
              TextTruncator.truncate(section.title(), maxTitleLength),
              section.level(),
              TextTruncator.truncate(content, maxContentLength)));
    }
    log.debug(
        "Segmented document into {} sections (frontmatter keys: {})",
        candidates.size(),
        frontmatter.metadata().keySet());
    return new SegmentedDocument(frontmatter.metadata(), candidates);
  }

  /**
   * Splits text at headers. The returned spans are contiguous and together cover the whole text.
   *
   * @param text markdown text with {@code \n} line endings
   * @return sections in document order, never empty
   */
  public List<MarkdownSection> extractSections(String text) {
    List<HeaderMatch> headers = findHeaders(text);

    List<MarkdownSection> sections = new ArrayList<>();
    if (headers.isEmpty()) {
      sections.add(new MarkdownSection(UNTITLED, 0, 0, text.length(), text));
      return sections;
    }

    int firstStart = headers.get(0).start();
    if (firstStart > 0) {
      sections.add(new MarkdownSection(UNTITLED, 0, 0, firstStart, text.substring(0, firstStart)));
    }
    for (int i = 0; i < headers.size(); i++) {
      HeaderMatch header = headers.get(i);
      int end = i + 1 < headers.size() ? headers.get(i + 1).start() : text.length();
      String span = text.substring(header.start(), end);
      sections.add(
          new MarkdownSection(header.title(), header.level(), header.start(), end, span));
    }
    return sections;
  }

  public String classify(String content, String title) {
    return categoryClassifier.classify(content, title);
  }

  private static List<HeaderMatch> findHeaders(String text) {
    MarkdownSource source = MarkdownSource.parse(text);
    List<HeaderMatch> headers = new ArrayList<>();
    for (Node node = source.document().getFirstChild(); node != null; node = node.getNext()) {
      if (!(node instanceof Heading)) {
        continue;
      }
      Heading heading = (Heading) node;
      int line = MarkdownSource.firstLine(heading);
      if (line < 0 || !source.line(line).startsWith("#")) {
        continue;
      }
      String title = headingText(heading);
      if (!title.isEmpty()) {
        headers.add(new HeaderMatch(source.lineStart(line), heading.getLevel(), title));
      }
    }
    return headers;
  }

  private static String headingText(Heading heading) {
    StringBuilder title = new StringBuilder();
    heading.accept(
        new AbstractVisitor() {
          @Override
          public void visit(Text text) {
            title.append(text.getLiteral());
          }

          @Override
          public void visit(Code code) {
            title.append(code.getLiteral());
          }
        });
    return title.toString().strip();
  }

  private record HeaderMatch(int start, int level, String title) {}
}
