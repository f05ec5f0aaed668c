package com.flamingo.ai.docqa.service.rag.chunking;

/**
 * A chunk of document text.
 *
 * @param index position of the chunk within its document, starting at 0
 * @param text trimmed chunk text
 * @param charOffset offset of the first character in the normalised document text
 * @param page 1-based page the chunk starts on
 */
public record TextChunk(int index, String text, int charOffset, int page) {}
