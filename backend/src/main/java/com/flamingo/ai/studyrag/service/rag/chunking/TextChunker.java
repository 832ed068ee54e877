package com.flamingo.ai.studyrag.service.rag.chunking;

import com.flamingo.ai.studyrag.service.rag.model.ContentBlock;
import com.flamingo.ai.studyrag.service.rag.model.SourceDocument;
import java.util.List;

/**
 * Splits raw source text into overlapping {@link ContentBlock}s ready for embedding.
 *
 * <p>Implementations are stateless, deterministic and safe for concurrent use: the same text and
 * window configuration always produce the same block boundaries and ids.
 */
public interface TextChunker {

  /**
   * Cuts {@code text} into windows of {@code windowSize} units sharing {@code overlap} units.
   *
   * @param text raw text; empty text yields no blocks
   * @param sourceId source identifier
   * @param deckId deck identifier
   * @param windowSize window size in this chunker's unit
   * @param overlap units shared by consecutive windows
   * @return blocks ordered by position
   * @throws com.flamingo.ai.studyrag.exception.ConfigException if {@code overlap >= windowSize}
   */
  List<ContentBlock> chunk(
      String text, String sourceId, String deckId, int windowSize, int overlap);

  /** Chunks a source with the configured window. */
  List<ContentBlock> chunk(SourceDocument source);

  ChunkUnit unit();
}
