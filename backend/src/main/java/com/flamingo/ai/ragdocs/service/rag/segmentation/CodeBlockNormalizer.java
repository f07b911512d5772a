package com.flamingo.ai.ragdocs.service.rag.segmentation;

import java.util.ArrayList;
import java.util.List;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.springframework.stereotype.Component;

/**
 * Replaces code in markdown with short placeholder lines so embeddings reflect prose rather than
 * code syntax.
 *
 * <p>Fenced blocks are taken from the commonmark AST and become {@code [CODE_BLOCK_<lang>: Code
 * example]} ({@code code} when the info string is empty). Only closed backtick fences opened at
 * the start of a line are replaced. A run of indented lines (four spaces or a tab) becomes a single
 * {@code [CODE_BLOCK: Indented code example]} line. Blank lines inside a commonmark indented code
 * block stay part of its run; indented lines that continue a paragraph are collapsed as well.
 */
@Component
public class CodeBlockNormalizer {

  static final String INDENTED_PLACEHOLDER = "[CODE_BLOCK: Indented code example]";

  private static final String FENCE = "```";

  public String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    MarkdownSource source = MarkdownSource.parse(text.replace("\r\n", "\n").replace('\r', '\n'));
    CodeLines code = new CodeLines(source);
    source.document().accept(code);

    List<String> processed = new ArrayList<>(source.lineCount());
    boolean inIndentedBlock = false;
    for (int i = 0; i < source.lineCount(); i++) {
      String line = source.line(i);
      if (code.fencePlaceholders[i] != null) {
        processed.add(code.fencePlaceholders[i]);
        inIndentedBlock = false;
      } else if (code.fenced[i]) {
        inIndentedBlock = false;
      } else if (code.indented[i] || isIndented(line)) {
        if (!inIndentedBlock) {
          inIndentedBlock = true;
          processed.add(INDENTED_PLACEHOLDER);
        }
      } else {
        inIndentedBlock = false;
        processed.add(line);
      }
    }
    return String.join("\n", processed);
  }

  static String fencedPlaceholder(String language) {
    return "[CODE_BLOCK_" + (language == null ? "code" : language) + ": Code example]";
  }

  private static boolean isIndented(String line) {
    return line.startsWith("    ") || line.startsWith("\t");
  }

  private static boolean isClosingFence(String line) {
    String stripped = line.strip();
    return stripped.startsWith(FENCE) && stripped.chars().allMatch(c -> c == '`');
  }

  private static String language(FencedCodeBlock block) {
    String info = block.getInfo();
    if (info == null || info.isBlank()) {
      return null;
    }
    return info.strip().split("\\s+", 2)[0];
  }

  /** Marks the lines that belong to code blocks of one parsed text. */
  private static final class CodeLines extends AbstractVisitor {

    private final MarkdownSource source;
    private final boolean[] fenced;
    private final boolean[] indented;
    private final String[] fencePlaceholders;

    CodeLines(MarkdownSource source) {
      this.source = source;
      this.fenced = new boolean[source.lineCount()];
      this.indented = new boolean[source.lineCount()];
      this.fencePlaceholders = new String[source.lineCount()];
    }

    @Override
    public void visit(FencedCodeBlock block) {
      int first = MarkdownSource.firstLine(block);
      if (first < 0 || !source.line(first).startsWith(FENCE)) {
        return;
      }
      // The closing fence line is not always part of the recorded span
      int last = MarkdownSource.lastLine(block);
      if ((last == first || !isClosingFence(source.line(last)))
          && last + 1 < source.lineCount()
          && isClosingFence(source.line(last + 1))) {
        last++;
      }
      if (last == first || !isClosingFence(source.line(last))) {
        return;
      }
      for (int i = first; i <= last; i++) {
        fenced[i] = true;
      }
      fencePlaceholders[first] = fencedPlaceholder(language(block));
    }

    @Override
    public void visit(IndentedCodeBlock block) {
      int first = MarkdownSource.firstLine(block);
      if (first < 0) {
        return;
      }
      int last = MarkdownSource.lastLine(block);
      // Trailing blank lines stay outside the run
      while (last >= first && source.line(last).isBlank()) {
        last--;
      }
      for (int i = first; i <= last; i++) {
        indented[i] = true;
      }
    }
  }
}
