package com.flamingo.ai.studyrag.service.rag.chunking;

/** Chunks text into windows of BPE tokens. */
public class TokenWindowChunker extends SlidingWindowChunker {

  private final TextTokenizer tokenizer;

  public TokenWindowChunker(ChunkingSettings settings, TextTokenizer tokenizer) {
    super(settings);
    this.tokenizer = tokenizer;
  }

  @Override
  protected Units split(String text) {
    int[] tokens = tokenizer.encode(text);
    return new Units() {
      @Override
      public int size() {
        return tokens.length;
      }

      @Override
      public String slice(int from, int to) {
        return tokenizer.decode(tokens, from, to);
      }
    };
  }
}
