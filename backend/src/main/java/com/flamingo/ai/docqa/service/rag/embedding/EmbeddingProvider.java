package com.flamingo.ai.docqa.service.rag.embedding;

import java.util.List;

/** A source of text embeddings. */
public interface EmbeddingProvider {

  /** Identifier stored with every vector this provider produces. */
  String modelId();

  int dimension();

  /** True for fallback providers whose vectors should be replaced once a real model is back. */
  default boolean degraded() {
    return false;
  }

  /**
   * Embeds texts.
   *
   * @param texts inputs, already truncated to the provider limit
   * @return one vector per input, in input order
   */
  List<float[]> embed(List<String> texts);
}
