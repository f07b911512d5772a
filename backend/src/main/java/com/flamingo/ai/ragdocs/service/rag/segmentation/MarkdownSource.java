package com.flamingo.ai.ragdocs.service.rag.segmentation;

import java.util.List;
import org.commonmark.node.Node;
import org.commonmark.node.SourceSpan;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

/**
 * A markdown text parsed by commonmark with block source spans, plus the line table needed to map
 * AST nodes back to lines and character offsets of the text.
 */
final class MarkdownSource {

  private static final Parser PARSER =
      Parser.builder().includeSourceSpans(IncludeSourceSpans.BLOCKS).build();

  private final String[] lines;
  private final int[] lineStarts;
  private final Node document;

  private MarkdownSource(String text) {
    this.lines = text.split("\n", -1);
    this.lineStarts = new int[lines.length];
    int offset = 0;
    for (int i = 0; i < lines.length; i++) {
      lineStarts[i] = offset;
      offset += lines[i].length() + 1;
    }
    this.document = PARSER.parse(text);
  }

  /** Parses text whose line endings are already {@code \n}. */
  static MarkdownSource parse(String text) {
    return new MarkdownSource(text);
  }

  Node document() {
    return document;
  }

  int lineCount() {
    return lines.length;
  }

  String line(int index) {
    return lines[index];
  }

  int lineStart(int index) {
    return lineStarts[index];
  }

  /** First source line of a block node, or -1 when the parser recorded no span. */
  static int firstLine(Node node) {
    List<SourceSpan> spans = node.getSourceSpans();
    return spans.isEmpty() ? -1 : spans.get(0).getLineIndex();
  }

  /** Last source line of a block node, or -1 when the parser recorded no span. */
  static int lastLine(Node node) {
    List<SourceSpan> spans = node.getSourceSpans();
    return spans.isEmpty() ? -1 : spans.get(spans.size() - 1).getLineIndex();
  }
}
