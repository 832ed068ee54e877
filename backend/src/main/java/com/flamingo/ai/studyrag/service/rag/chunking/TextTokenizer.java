package com.flamingo.ai.studyrag.service.rag.chunking;

/**
 * Converts text to and from model tokens. Implementations must be thread-safe and deterministic.
 */
public interface TextTokenizer {

  /**
   * Encodes text into token ids.
   *
   * @param text the text
   * @return token ids, empty for empty text
   */
  int[] encode(String text);

  /**
   * Decodes the token range {@code [from, to)} back to text.
   *
   * @param tokens token ids
   * @param from first token, inclusive
   * @param to last token, exclusive
   * @return decoded text
   */
  String decode(int[] tokens, int from, int to);

  int countTokens(String text);

  /** Returns the longest token prefix of {@code text} that fits in {@code maxTokens}. */
  default String truncate(String text, int maxTokens) {
    int[] tokens = encode(text);
    if (tokens.length <= maxTokens) {
      return text;
    }
    return decode(tokens, 0, Math.max(0, maxTokens));
  }
}
