package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import com.flamingo.ai.docqa.service.document.ChunkFailure;
import com.flamingo.ai.docqa.service.document.IngestionResult;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a (re)indexing run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private UUID documentId;
  private DocumentStatus status;
  private int indexedChunks;
  private List<ChunkFailure> failures;
  private String embeddingModelId;
  private boolean degraded;

  public static IngestionResponse fromResult(IngestionResult result) {
    return IngestionResponse.builder()
        .documentId(result.documentId())
        .status(result.status())
        .indexedChunks(result.indexedChunks())
        .failures(result.failures())
        .embeddingModelId(result.embeddingModelId())
        .degraded(result.degraded())
        .build();
  }
}
