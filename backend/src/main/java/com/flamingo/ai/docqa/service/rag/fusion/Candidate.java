package com.flamingo.ai.docqa.service.rag.fusion;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/** A chunk competing for the context of one query. Lives only for that retrieval call. */
@Data
@Builder(toBuilder = true)
public class Candidate {

  private String chunkId;
  private String ownerId;
  private UUID documentId;
  private String documentName;
  private int chunkIndex;
  private String text;
  private int page;
  private int charOffset;

  /** 1-based rank in the semantic list, null when absent from it. */
  private Integer semanticRank;

  /** 1-based rank in the lexical list, null when absent from it. */
  private Integer lexicalRank;

  /** Cosine similarity to the query. */
  private Double semanticScore;

  /** BM25 score. */
  private Double lexicalScore;

  private double fusedScore;

  /** Fused score divided by the best achievable score, clamped to 1. */
  private double normalizedScore;

  private MatchType matchType;

  /** The list that ranked this candidate better; semantic wins ties. */
  private MatchType dominantType;

  static Candidate from(ChunkRecord chunk) {
    return Candidate.builder()
        .chunkId(chunk.getId())
        .ownerId(chunk.getOwnerId())
        .documentId(chunk.getDocumentId())
        .documentName(chunk.getDocumentName())
        .chunkIndex(chunk.getChunkIndex())
        .text(chunk.getText())
        .page(chunk.getPage())
        .charOffset(chunk.getCharOffset())
        .build();
  }
}
