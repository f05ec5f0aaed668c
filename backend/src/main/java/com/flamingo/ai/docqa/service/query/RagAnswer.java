package com.flamingo.ai.docqa.service.query;

import com.flamingo.ai.docqa.service.rag.generation.SourceReference;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalTier;
import java.util.List;

/**
 * Answer to a {@link RagQuery}.
 *
 * @param tier retrieval path that produced the context
 * @param grounded false when no passage was found and the answer discloses it
 * @param degraded true when generation timed out
 * @param lowConfidence true when no retrieval path reached the similarity threshold
 */
public record RagAnswer(
    String query,
    String answerText,
    List<SourceReference> sources,
    RetrievalTier tier,
    boolean grounded,
    boolean degraded,
    boolean lowConfidence) {}
