package com.flamingo.ai.docqa.service.rag.retrieval;

import com.flamingo.ai.docqa.service.rag.fusion.Candidate;
import java.util.List;

/**
 * Outcome of retrieval.
 *
 * @param tier the path that produced the candidates
 * @param candidates best first, at most top-k
 * @param lowConfidence true when no tier cleared the confidence threshold and these are the best
 *     below-threshold candidates found
 */
public record RetrievalResult(
    RetrievalTier tier, List<Candidate> candidates, boolean lowConfidence) {

  public static RetrievalResult empty() {
    return new RetrievalResult(RetrievalTier.EMPTY, List.of(), false);
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }
}
