package com.flamingo.ai.ragdocs.service.rag.segmentation;

/**
 * Bounds text to a storage limit without cutting a word in half.
 *
 * <p>Truncated output ends with {@link #ELLIPSIS} and is never longer than the limit, so applying
 * the same limit again returns it unchanged.
 */
public final class TextTruncator {

  public static final String ELLIPSIS = "...";

  private TextTruncator() {}

  /**
   * Truncates {@code text} to at most {@code maxLength} characters.
   *
   * <p>The cut falls on the last whitespace before the limit. A text with no whitespace in range
   * is cut hard at the limit.
   *
   * @param text the text to bound, may be null
   * @param maxLength the maximum length of the result
   * @return the text itself when it fits, otherwise the truncated text with an ellipsis
   */
  public static String truncate(String text, int maxLength) {
    if (text == null || text.length() <= maxLength) {
      return text;
    }
    if (maxLength <= ELLIPSIS.length()) {
      return text.substring(0, safeCut(text, maxLength));
    }

    int budget = maxLength - ELLIPSIS.length();
    int cut = budget;
    if (!Character.isWhitespace(text.charAt(budget))) {
      int lastSpace = lastWhitespaceBefore(text, budget);
      cut = lastSpace > 0 ? lastSpace : safeCut(text, budget);
    }

    String head = text.substring(0, cut).stripTrailing();
    if (head.isEmpty()) {
      head = text.substring(0, safeCut(text, budget));
    }
    return head + ELLIPSIS;
  }

  private static int lastWhitespaceBefore(String text, int end) {
    for (int i = end - 1; i > 0; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  // Never split a surrogate pair.
  private static int safeCut(String text, int index) {
    if (index > 0 && Character.isHighSurrogate(text.charAt(index - 1))) {
      return index - 1;
    }
    return index;
  }
}
