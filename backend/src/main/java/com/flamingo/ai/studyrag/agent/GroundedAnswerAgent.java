package com.flamingo.ai.studyrag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that answers a question strictly from numbered context passages.
 *
 * <p>Passages are labelled {@code [1]}, {@code [2]}, ... and the answer cites them inline with the
 * same labels.
 */
public interface GroundedAnswerAgent {

  @SystemMessage(
      """
        You are a helpful study assistant. Answer the question using ONLY the provided context.
        Cite sources inline as [1], [2], ... referring to the numbered context items.
        If the answer is not in the context, say you don't know. Be concise.
        """)
  @UserMessage(
      """
        Context:
        {{context}}

        Question: {{question}}
        Answer:
        """)
  String answer(@V("question") String question, @V("context") String context);
}
