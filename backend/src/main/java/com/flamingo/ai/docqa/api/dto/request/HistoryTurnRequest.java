package com.flamingo.ai.docqa.api.dto.request;

import com.flamingo.ai.docqa.service.rag.generation.ConversationTurn;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One earlier turn of the conversation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryTurnRequest {

  @NotNull(message = "Role is required")
  private ConversationTurn.Role role;

  @NotBlank(message = "Content is required")
  private String content;

  public ConversationTurn toTurn() {
    return new ConversationTurn(role, content);
  }
}
