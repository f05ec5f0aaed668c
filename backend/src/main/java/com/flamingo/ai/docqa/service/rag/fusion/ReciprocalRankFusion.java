package com.flamingo.ai.docqa.service.rag.fusion;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reciprocal Rank Fusion of a semantic and a lexical ranking.
 *
 * <p>{@code score = sum over lists containing the chunk of 1 / (K + rank)}. Order is fully
 * deterministic: fused score, then semantic rank, then lexical rank, then chunk id.
 */
@Component
@RequiredArgsConstructor
public class ReciprocalRankFusion {

  private static final Comparator<Candidate> ORDER =
      Comparator.comparingDouble(Candidate::getFusedScore)
          .reversed()
          .thenComparing(
              Candidate::getSemanticRank, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(Candidate::getLexicalRank, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(Candidate::getChunkId);

  private final RagConfig ragConfig;

  public List<Candidate> fuse(List<ScoredChunk> semantic, List<ScoredChunk> lexical) {
    return fuse(semantic, lexical, ragConfig.getRetrieval().getRrfK());
  }

  /**
   * Fuses two rankings.
   *
   * @param semantic chunks by descending similarity; position gives the rank
   * @param lexical chunks by descending BM25 score
   * @param k RRF constant
   * @return every chunk from either list, best first
   */
  public List<Candidate> fuse(List<ScoredChunk> semantic, List<ScoredChunk> lexical, int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("RRF constant must be positive, got " + k);
    }
    Map<String, Candidate> byId = new LinkedHashMap<>();
    for (int i = 0; i < semantic.size(); i++) {
      ScoredChunk hit = semantic.get(i);
      Candidate candidate = byId.computeIfAbsent(hit.chunkId(), id -> Candidate.from(hit.chunk()));
      if (candidate.getSemanticRank() == null) {
        candidate.setSemanticRank(i + 1);
        candidate.setSemanticScore(hit.score());
      }
    }
    for (int i = 0; i < lexical.size(); i++) {
      ScoredChunk hit = lexical.get(i);
      Candidate candidate = byId.computeIfAbsent(hit.chunkId(), id -> Candidate.from(hit.chunk()));
      if (candidate.getLexicalRank() == null) {
        candidate.setLexicalRank(i + 1);
        candidate.setLexicalScore(hit.score());
      }
    }

    double maxScore = 2.0 / k;
    List<Candidate> fused = new ArrayList<>(byId.values());
    for (Candidate candidate : fused) {
      double score = 0;
      if (candidate.getSemanticRank() != null) {
        score += 1.0 / (k + candidate.getSemanticRank());
      }
      if (candidate.getLexicalRank() != null) {
        score += 1.0 / (k + candidate.getLexicalRank());
      }
      candidate.setFusedScore(score);
      candidate.setNormalizedScore(Math.min(1.0, score / maxScore));
      candidate.setMatchType(matchType(candidate));
      candidate.setDominantType(dominantType(candidate));
    }
    fused.sort(ORDER);
    return fused;
  }

  private static MatchType matchType(Candidate candidate) {
    if (candidate.getSemanticRank() != null && candidate.getLexicalRank() != null) {
      return MatchType.HYBRID;
    }
    return candidate.getSemanticRank() != null ? MatchType.SEMANTIC : MatchType.LEXICAL;
  }

  private static MatchType dominantType(Candidate candidate) {
    if (candidate.getLexicalRank() == null) {
      return MatchType.SEMANTIC;
    }
    if (candidate.getSemanticRank() == null) {
      return MatchType.LEXICAL;
    }
    return candidate.getLexicalRank() < candidate.getSemanticRank()
        ? MatchType.LEXICAL
        : MatchType.SEMANTIC;
  }
}
