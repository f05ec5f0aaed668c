package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String name;
  private DocumentStatus status;
  private Integer chunkCount;
  private Integer failedChunkCount;
  private String processingError;
  private LocalDateTime uploadedAt;
  private LocalDateTime processedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .name(document.getName())
        .status(document.getStatus())
        .chunkCount(document.getChunkCount())
        .failedChunkCount(document.getFailedChunkCount())
        .processingError(document.getProcessingError())
        .uploadedAt(document.getUploadedAt())
        .processedAt(document.getProcessedAt())
        .build();
  }
}
