package com.flamingo.ai.docqa.service.rag.vector;

/** A native backend hit; {@code similarity} is cosine similarity in [-1, 1]. */
public record NativeVectorHit(String chunkId, double similarity) {}
