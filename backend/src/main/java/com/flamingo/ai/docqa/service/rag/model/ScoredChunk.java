package com.flamingo.ai.docqa.service.rag.model;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;

/** A chunk with the score one ranking gave it. */
public record ScoredChunk(ChunkRecord chunk, double score) {

  public String chunkId() {
    return chunk.getId();
  }
}
