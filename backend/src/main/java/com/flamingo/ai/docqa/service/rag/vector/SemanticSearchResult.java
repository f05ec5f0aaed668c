package com.flamingo.ai.docqa.service.rag.vector;

import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import java.util.List;

/**
 * Semantic ranking plus whether the native backend served it.
 *
 * @param hits chunks by descending cosine similarity
 * @param usedNative true when the native backend answered, false for brute force
 */
public record SemanticSearchResult(List<ScoredChunk> hits, boolean usedNative) {}
