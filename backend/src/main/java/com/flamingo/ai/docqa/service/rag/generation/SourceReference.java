package com.flamingo.ai.docqa.service.rag.generation;

/** A context block the answer may cite, echoed back to the caller. */
public record SourceReference(String chunkId, String documentName, String preview) {}
