package com.flamingo.ai.docqa.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RagQueryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 50, message = "topK must not exceed 50")
  private Integer topK;

  /** Optional document to restrict retrieval to. */
  private UUID documentId;

  @Valid @Builder.Default private List<HistoryTurnRequest> history = new ArrayList<>();

  @DecimalMin(value = "0.0", message = "temperature must be at least 0")
  @DecimalMax(value = "2.0", message = "temperature must not exceed 2")
  private Double temperature;

  @Min(value = 1, message = "maxTokens must be at least 1")
  private Integer maxTokens;
}
