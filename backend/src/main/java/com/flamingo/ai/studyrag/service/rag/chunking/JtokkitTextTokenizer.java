package com.flamingo.ai.studyrag.service.rag.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

/** {@link TextTokenizer} backed by the {@code cl100k_base} BPE encoding used by OpenAI models. */
public class JtokkitTextTokenizer implements TextTokenizer {

  private final Encoding encoding;

  public JtokkitTextTokenizer() {
    this(EncodingType.CL100K_BASE);
  }

  public JtokkitTextTokenizer(EncodingType encodingType) {
    this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(encodingType);
  }

  @Override
  public int[] encode(String text) {
    if (text == null || text.isEmpty()) {
      return new int[0];
    }
    IntArrayList encoded = encoding.encode(text);
    int[] tokens = new int[encoded.size()];
    for (int i = 0; i < tokens.length; i++) {
      tokens[i] = encoded.get(i);
    }
    return tokens;
  }

  @Override
  public String decode(int[] tokens, int from, int to) {
    IntArrayList window = new IntArrayList(Math.max(0, to - from));
    for (int i = from; i < to; i++) {
      window.add(tokens[i]);
    }
    return encoding.decode(window);
  }

  @Override
  public int countTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return encoding.countTokens(text);
  }
}
