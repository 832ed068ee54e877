package com.flamingo.ai.studyrag.service.rag.retrieval;

import com.flamingo.ai.studyrag.service.rag.chunking.TextTokenizer;
import com.flamingo.ai.studyrag.service.rag.model.PackedContext;
import com.flamingo.ai.studyrag.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Packs retrieved chunks into a token-bounded context and assigns citation indices.
 *
 * <p>Chunks are visited in descending score order. A chunk is accepted when it still fits the
 * remaining budget, otherwise it is skipped and later, smaller chunks are still considered.
 * Repeated records and repeated texts are skipped. When nothing fits, the best chunk is truncated
 * to the budget so the context is never empty for a non-empty input.
 */
@RequiredArgsConstructor
@Slf4j
public class ContextPacker {

  private final TextTokenizer tokenizer;

  public PackedContext pack(List<RetrievedChunk> chunks, int maxContextTokens) {
    if (chunks.isEmpty()) {
      return PackedContext.empty();
    }

    List<RetrievedChunk> ranked = new ArrayList<>(chunks);
    ranked.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());

    List<RetrievedChunk> accepted = new ArrayList<>();
    Set<String> seenRecords = new HashSet<>();
    Set<String> seenTexts = new HashSet<>();
    int running = 0;
    int skipped = 0;

    for (RetrievedChunk chunk : ranked) {
      if (!seenRecords.add(chunk.recordId()) || !seenTexts.add(chunk.text().strip())) {
        skipped++;
        continue;
      }
      int tokens = tokenizer.countTokens(chunk.text());
      if (running + tokens > maxContextTokens) {
        skipped++;
        continue;
      }
      accepted.add(chunk.withCitationIndex(accepted.size() + 1));
      running += tokens;
    }

    if (accepted.isEmpty()) {
      RetrievedChunk best = ranked.get(0);
      String truncated = truncateToBudget(best.text(), maxContextTokens);
      accepted.add(best.withText(truncated).withCitationIndex(1));
      running = tokenizer.countTokens(truncated);
      log.debug(
          "No chunk fits {} tokens; truncated best chunk {} to {} tokens",
          maxContextTokens,
          best.recordId(),
          running);
    }

    log.debug(
        "Packed {} of {} chunk(s), {} skipped, {}/{} tokens",
        accepted.size(),
        chunks.size(),
        skipped,
        running,
        maxContextTokens);
    return new PackedContext(render(accepted), accepted, running);
  }

  private String truncateToBudget(String text, int maxTokens) {
    String truncated = tokenizer.truncate(text, maxTokens);
    int budget = maxTokens;
    // Re-encoding a decoded prefix can merge differently at the cut
    while (budget > 0 && tokenizer.countTokens(truncated) > maxTokens) {
      budget--;
      truncated = tokenizer.truncate(text, budget);
    }
    return truncated;
  }

  private static String render(List<RetrievedChunk> accepted) {
    StringJoiner joiner = new StringJoiner("\n\n");
    for (RetrievedChunk chunk : accepted) {
      joiner.add("[" + chunk.citationIndex() + "] " + chunk.text());
    }
    return joiner.toString();
  }
}
