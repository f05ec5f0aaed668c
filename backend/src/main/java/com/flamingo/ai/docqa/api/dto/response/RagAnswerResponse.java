package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.service.query.RagAnswer;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalTier;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RagAnswerResponse {

  private String query;
  private String answer;
  private List<SourceResponse> sources;
  private RetrievalTier tier;
  private boolean grounded;
  private boolean degraded;
  private boolean lowConfidence;

  public static RagAnswerResponse fromAnswer(RagAnswer answer) {
    return RagAnswerResponse.builder()
        .query(answer.query())
        .answer(answer.answerText())
        .sources(answer.sources().stream().map(SourceResponse::fromReference).toList())
        .tier(answer.tier())
        .grounded(answer.grounded())
        .degraded(answer.degraded())
        .lowConfidence(answer.lowConfidence())
        .build();
  }
}
