package com.flamingo.ai.studyrag.service.rag.chunking;

/** Chunks text into windows of characters. Used when no tokenizer is configured. */
public class CharacterWindowChunker extends SlidingWindowChunker {

  public CharacterWindowChunker(ChunkingSettings settings) {
    super(settings);
  }

  @Override
  protected Units split(String text) {
    return new Units() {
      @Override
      public int size() {
        return text.length();
      }

      @Override
      public String slice(int from, int to) {
        return text.substring(from, to);
      }
    };
  }
}
