package com.flamingo.ai.docqa.domain.enums;

/** Indexing lifecycle of a document. */
public enum DocumentStatus {
  /** Text received, indexing not started yet. */
  UPLOADING,

  /** Being chunked, embedded and indexed. */
  PROCESSING,

  /** Indexed and searchable. Some chunks may have failed; see the failed chunk count. */
  READY,

  /** Indexing failed for the whole document. */
  ERROR
}
