package com.flamingo.ai.docqa.service.rag.retrieval;

/** Retrieval paths in the order they are tried. */
public enum RetrievalTier {
  /** Native vector backend fused with BM25. */
  NATIVE_VECTOR,

  /** Brute-force cosine similarity fused with BM25. */
  LOCAL_SIMILARITY,

  /** Documents shortlisted by free-text search, chunked and embedded on the fly. */
  LEXICAL_PREFILTER_RECOMPUTE,

  /** Nothing found anywhere. */
  EMPTY
}
