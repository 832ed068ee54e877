package com.flamingo.ai.studyrag.service.rag.chunking;

import com.flamingo.ai.studyrag.service.rag.model.ContentBlock;
import com.flamingo.ai.studyrag.service.rag.model.SourceDocument;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Sliding-window chunking shared by the token and character chunkers.
 *
 * <p>Windows start at multiples of {@code windowSize - overlap} and the last window ends exactly at
 * the end of the text. Subclasses only decide what a unit is.
 */
@Slf4j
public abstract class SlidingWindowChunker implements TextChunker {

  protected final ChunkingSettings settings;

  protected SlidingWindowChunker(ChunkingSettings settings) {
    this.settings = settings;
  }

  /** Splits text into addressable units. */
  protected abstract Units split(String text);

  @Override
  public List<ContentBlock> chunk(SourceDocument source) {
    return chunk(
        source.rawText(),
        source.sourceId(),
        source.deckId(),
        settings.size(),
        settings.overlap());
  }

  @Override
  public List<ContentBlock> chunk(
      String text, String sourceId, String deckId, int windowSize, int overlap) {
    ChunkingSettings.validateWindow(windowSize, overlap);
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    Units units = split(text);
    int total = units.size();
    if (total == 0) {
      return List.of();
    }

    List<Window> windows = new ArrayList<>();
    if (total <= windowSize) {
      // Single window keeps the original text byte-for-byte
      windows.add(new Window(text, 0, total));
    } else {
      int start = 0;
      while (true) {
        int end = Math.min(start + windowSize, total);
        windows.add(new Window(units.slice(start, end), start, end));
        if (end == total) {
          break;
        }
        start = end - overlap;
      }
    }

    if (settings.dedupe()) {
      windows = dedupe(windows);
    }

    List<ContentBlock> blocks = new ArrayList<>(windows.size());
    for (int position = 0; position < windows.size(); position++) {
      Window window = windows.get(position);
      blocks.add(
          new ContentBlock(
              blockId(deckId, sourceId, position),
              sourceId,
              deckId,
              window.text(),
              window.end() - window.start(),
              position,
              Map.of(
                  "unit", unit().name().toLowerCase(),
                  "start", String.valueOf(window.start()),
                  "end", String.valueOf(window.end()))));
    }
    log.debug(
        "Chunked source {} (deck {}): {} {}s -> {} blocks",
        sourceId,
        deckId,
        total,
        unit().name().toLowerCase(),
        blocks.size());
    return blocks;
  }

  @Override
  public ChunkUnit unit() {
    return settings.unit();
  }

  /** Deterministic, source-scoped block id. */
  public static String blockId(String deckId, String sourceId, int position) {
    String key = deckId + "/" + sourceId + "/" + position;
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private List<Window> dedupe(List<Window> windows) {
    Set<HashCode> seen = new HashSet<>();
    List<Window> unique = new ArrayList<>(windows.size());
    for (Window window : windows) {
      String trimmed = window.text().strip();
      if (trimmed.length() <= settings.minChunkChars()) {
        continue;
      }
      if (seen.add(Hashing.sha256().hashString(trimmed, StandardCharsets.UTF_8))) {
        unique.add(window);
      }
    }
    return unique;
  }

  /** Random access over the units of one text. */
  protected interface Units {
    int size();

    String slice(int from, int to);
  }

  private record Window(String text, int start, int end) {}
}
