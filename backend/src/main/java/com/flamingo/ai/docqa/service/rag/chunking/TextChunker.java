package com.flamingo.ai.docqa.service.rag.chunking;

import java.util.List;

/** Splits document text into overlapping chunks. */
public interface TextChunker {

  /**
   * Splits text into chunks of at most {@code chunkSize} characters.
   *
   * @param text document text, may be empty
   * @param chunkSize maximum characters per chunk
   * @param overlap characters carried over between neighbouring chunks, {@code 0 <= overlap <
   *     chunkSize}
   * @return chunks in document order; empty for blank input
   */
  List<TextChunk> chunk(String text, int chunkSize, int overlap);

  default List<String> split(String text, int chunkSize, int overlap) {
    return chunk(text, chunkSize, overlap).stream().map(TextChunk::text).toList();
  }
}
