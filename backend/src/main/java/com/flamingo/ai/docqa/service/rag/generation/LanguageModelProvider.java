package com.flamingo.ai.docqa.service.rag.generation;

import dev.langchain4j.data.message.ChatMessage;
import java.util.List;

/** A chat-completion backend addressed by model id. */
public interface LanguageModelProvider {

  /**
   * Completes a conversation.
   *
   * @param messages system, history and user messages in order
   * @param modelId the model to use
   * @return the assistant's reply text
   */
  String complete(List<ChatMessage> messages, String modelId, GenerationOptions options);
}
