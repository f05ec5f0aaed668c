package com.flamingo.ai.docqa.service.document;

/** A chunk that could not be embedded; the rest of its document is still indexed. */
public record ChunkFailure(int chunkIndex, String message) {}
