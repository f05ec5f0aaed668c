package com.flamingo.ai.docqa.service.rag.lexical;

import com.flamingo.ai.docqa.domain.entity.ChunkRecord;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable BM25 snapshot of one chunk corpus.
 *
 * <p>{@code idf(t) = ln((N - df + 0.5) / (df + 0.5))}. Terms present in more than half of the
 * corpus therefore contribute negatively. Chunks that score exactly zero are left out of results.
 */
public final class Bm25Index {

  private static final Comparator<ScoredChunk> BY_SCORE =
      Comparator.comparingDouble(ScoredChunk::score)
          .reversed()
          .thenComparing(ScoredChunk::chunkId);

  private final List<ChunkRecord> chunks;
  private final List<Map<String, Integer>> termFrequencies;
  private final int[] lengths;
  private final Map<String, Integer> documentFrequencies;
  private final double averageLength;
  private final double k1;
  private final double b;

  private Bm25Index(
      List<ChunkRecord> chunks,
      List<Map<String, Integer>> termFrequencies,
      int[] lengths,
      Map<String, Integer> documentFrequencies,
      double k1,
      double b) {
    this.chunks = chunks;
    this.termFrequencies = termFrequencies;
    this.lengths = lengths;
    this.documentFrequencies = documentFrequencies;
    this.k1 = k1;
    this.b = b;
    long total = 0;
    for (int length : lengths) {
      total += length;
    }
    this.averageLength = lengths.length == 0 ? 0 : (double) total / lengths.length;
  }

  public static Bm25Index build(List<ChunkRecord> chunks, double k1, double b) {
    List<Map<String, Integer>> termFrequencies = new ArrayList<>(chunks.size());
    int[] lengths = new int[chunks.size()];
    Map<String, Integer> documentFrequencies = new HashMap<>();
    for (int i = 0; i < chunks.size(); i++) {
      List<String> tokens = TextTokenizer.tokenize(chunks.get(i).getText());
      lengths[i] = tokens.size();
      Map<String, Integer> tf = new HashMap<>();
      for (String token : tokens) {
        tf.merge(token, 1, Integer::sum);
      }
      for (String term : tf.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      termFrequencies.add(tf);
    }
    return new Bm25Index(
        List.copyOf(chunks), termFrequencies, lengths, documentFrequencies, k1, b);
  }

  public int size() {
    return chunks.size();
  }

  /**
   * Ranks chunks against a query.
   *
   * @param documentId restricts results to one document, or {@code null}
   * @return at most {@code k} chunks with a non-zero score, best first, ties by chunk id
   */
  public List<ScoredChunk> search(String query, int k, UUID documentId) {
    Set<String> terms = new LinkedHashSet<>(TextTokenizer.tokenize(query));
    if (terms.isEmpty() || chunks.isEmpty() || k <= 0) {
      return List.of();
    }
    int n = chunks.size();
    double avgLength = averageLength > 0 ? averageLength : 1.0;

    List<ScoredChunk> scored = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      ChunkRecord chunk = chunks.get(i);
      if (documentId != null && !documentId.equals(chunk.getDocumentId())) {
        continue;
      }
      Map<String, Integer> tf = termFrequencies.get(i);
      double score = 0;
      for (String term : terms) {
        Integer freq = tf.get(term);
        if (freq == null) {
          continue;
        }
        int df = documentFrequencies.get(term);
        double idf = Math.log((n - df + 0.5) / (df + 0.5));
        double norm = freq + k1 * (1 - b + b * lengths[i] / avgLength);
        score += idf * (freq * (k1 + 1)) / norm;
      }
      if (score != 0) {
        scored.add(new ScoredChunk(chunk, score));
      }
    }
    return scored.stream().sorted(BY_SCORE).limit(k).toList();
  }
}
