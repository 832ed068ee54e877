package com.flamingo.ai.studyrag.service.rag.model;

import java.util.Map;

/**
 * A bounded span of source text produced by a {@link
 * com.flamingo.ai.studyrag.service.rag.chunking.TextChunker}, before embedding.
 *
 * @param id deterministic id derived from deck, source and position
 * @param sourceId source the block was cut from
 * @param deckId deck the source belongs to
 * @param text the window text
 * @param tokenCount size of the window in chunking units (tokens, or characters for the character
 *     chunker); never larger than the configured window size
 * @param position 0-based window index within the source
 * @param metadata free-form annotations (chunking unit, character offset)
 */
public record ContentBlock(
    String id,
    String sourceId,
    String deckId,
    String text,
    int tokenCount,
    int position,
    Map<String, String> metadata) {

  public ContentBlock {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
