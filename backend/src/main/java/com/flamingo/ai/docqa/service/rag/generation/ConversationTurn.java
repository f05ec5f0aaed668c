package com.flamingo.ai.docqa.service.rag.generation;

/** One prior message of the conversation. */
public record ConversationTurn(Role role, String content) {

  public enum Role {
    USER,
    ASSISTANT
  }
}
