package com.flamingo.ai.docqa.service.rag.generation;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** {@link LanguageModelProvider} over a LangChain4j {@link ChatModel}; the model id is per call. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jLanguageModelProvider implements LanguageModelProvider {

  private final ChatModel chatModel;

  @Override
  public String complete(List<ChatMessage> messages, String modelId, GenerationOptions options) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(messages)
            .modelName(modelId)
            .temperature(options.temperature())
            .maxOutputTokens(options.maxTokens())
            .build();
    log.debug("Calling chat model {} with {} messages", modelId, messages.size());
    ChatResponse response = chatModel.chat(request);
    String text = response.aiMessage().text();
    return text == null ? "" : text;
  }
}
