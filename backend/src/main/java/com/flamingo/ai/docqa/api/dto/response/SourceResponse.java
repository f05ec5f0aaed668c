package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.service.rag.generation.SourceReference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A passage cited by an answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResponse {

  private String chunkId;
  private String documentName;
  private String preview;

  public static SourceResponse fromReference(SourceReference reference) {
    return SourceResponse.builder()
        .chunkId(reference.chunkId())
        .documentName(reference.documentName())
        .preview(reference.preview())
        .build();
  }
}
