package com.flamingo.ai.docqa.service.rag.embedding;

import com.flamingo.ai.docqa.service.rag.lexical.TextTokenizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Last-resort embedder that needs no network: feature hashing of words and character trigrams into
 * an L2-normalised vector. Similarity between its vectors approximates lexical overlap only, so its
 * output is flagged degraded and re-embedded later.
 */
public class HashEmbeddingProvider implements EmbeddingProvider {

  public static final String MODEL_ID = "hash-fallback-v1";

  private static final int WORD_SLOTS = 4;
  private static final float WORD_WEIGHT = 1.0f;
  private static final float TRIGRAM_WEIGHT = 0.35f;

  private final int dimension;

  public HashEmbeddingProvider(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("Dimension must be positive, got " + dimension);
    }
    this.dimension = dimension;
  }

  @Override
  public String modelId() {
    return MODEL_ID;
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public boolean degraded() {
    return true;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embedOne(text));
    }
    return vectors;
  }

  private float[] embedOne(String text) {
    float[] vector = new float[dimension];
    for (String word : TextTokenizer.tokenize(text)) {
      int hash = word.hashCode();
      for (int slot = 0; slot < WORD_SLOTS; slot++) {
        int mixed = mix(hash + slot * 0x9E3779B9);
        vector[Math.floorMod(mixed, dimension)] += mixed >= 0 ? WORD_WEIGHT : -WORD_WEIGHT;
      }
      String padded = "^" + word + "$";
      for (int i = 0; i + 3 <= padded.length(); i++) {
        int mixed = mix(padded.substring(i, i + 3).hashCode());
        vector[Math.floorMod(mixed, dimension)] +=
            mixed >= 0 ? TRIGRAM_WEIGHT : -TRIGRAM_WEIGHT;
      }
    }
    double norm = 0;
    for (float v : vector) {
      norm += v * v;
    }
    if (norm > 0) {
      float scale = (float) (1.0 / Math.sqrt(norm));
      for (int i = 0; i < vector.length; i++) {
        vector[i] *= scale;
      }
    }
    return vector;
  }

  // murmur3 finaliser
  private static int mix(int h) {
    h ^= h >>> 16;
    h *= 0x85ebca6b;
    h ^= h >>> 13;
    h *= 0xc2b2ae35;
    h ^= h >>> 16;
    return h;
  }
}
