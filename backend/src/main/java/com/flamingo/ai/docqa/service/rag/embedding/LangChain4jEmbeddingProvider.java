package com.flamingo.ai.docqa.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Embeds through a LangChain4j {@link EmbeddingModel}. */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final String modelId;
  private final int dimension;
  private final EmbeddingModel embeddingModel;

  public LangChain4jEmbeddingProvider(
      String modelId, int dimension, EmbeddingModel embeddingModel) {
    this.modelId = modelId;
    this.dimension = dimension;
    this.embeddingModel = embeddingModel;
  }

  @Override
  public String modelId() {
    return modelId;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(text));
    }
    log.debug("Calling embedding model {} for {} texts", modelId, texts.size());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vector());
    }
    return vectors;
  }
}
