package com.flamingo.ai.docqa.service.rag.chunking;

import com.flamingo.ai.docqa.exception.RagValidationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recursive character splitter.
 *
 * <p>Text is split on the first separator that occurs in it (paragraph, line, sentence, word, then
 * single characters). Pieces keep their trailing separator and are merged greedily up to the chunk
 * size, carrying at most {@code overlap} characters of trailing pieces into the next chunk. Pieces
 * that are still too large are split again with the remaining separators.
 *
 * <p>All work is done on offsets into the normalised text so every chunk knows where it starts.
 */
@Component
@Slf4j
public class RecursiveCharacterChunker implements TextChunker {

  static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", "? ", "! ", " ", "");

  private static final char PAGE_BREAK = '\f';

  @Override
  public List<TextChunk> chunk(String text, int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new RagValidationException("Chunk size must be positive, got " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new RagValidationException(
          "Chunk overlap must be in [0, " + chunkSize + "), got " + overlap);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }

    String normalised = text.replace("\r\n", "\n").replace('\r', '\n');
    List<Span> spans =
        splitRecursive(
            normalised, new Span(0, normalised.length()), SEPARATORS, chunkSize, overlap);

    List<TextChunk> chunks = new ArrayList<>();
    for (Span span : spans) {
      int start = span.start();
      int end = span.end();
      while (start < end && Character.isWhitespace(normalised.charAt(start))) {
        start++;
      }
      while (end > start && Character.isWhitespace(normalised.charAt(end - 1))) {
        end--;
      }
      if (start == end) {
        continue;
      }
      chunks.add(
          new TextChunk(
              chunks.size(), normalised.substring(start, end), start, pageAt(normalised, start)));
    }
    log.debug(
        "Split {} chars into {} chunks (size={}, overlap={})",
        normalised.length(),
        chunks.size(),
        chunkSize,
        overlap);
    return chunks;
  }

  private List<Span> splitRecursive(
      String text, Span range, List<String> separators, int chunkSize, int overlap) {
    String separator = "";
    List<String> remaining = List.of();
    for (int i = 0; i < separators.size(); i++) {
      String candidate = separators.get(i);
      if (candidate.isEmpty() || indexOf(text, candidate, range.start(), range.end()) >= 0) {
        separator = candidate;
        remaining = separators.subList(i + 1, separators.size());
        break;
      }
    }

    List<Span> output = new ArrayList<>();
    List<Span> fitting = new ArrayList<>();
    for (Span piece : pieces(text, range, separator)) {
      if (piece.length() < chunkSize) {
        fitting.add(piece);
        continue;
      }
      if (!fitting.isEmpty()) {
        output.addAll(merge(fitting, chunkSize, overlap));
        fitting.clear();
      }
      if (remaining.isEmpty()) {
        output.add(piece);
      } else {
        output.addAll(splitRecursive(text, piece, remaining, chunkSize, overlap));
      }
    }
    if (!fitting.isEmpty()) {
      output.addAll(merge(fitting, chunkSize, overlap));
    }
    return output;
  }

  /** Cuts the range after each occurrence of the separator; the separator stays on the left. */
  private static List<Span> pieces(String text, Span range, String separator) {
    List<Span> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      for (int i = range.start(); i < range.end(); i++) {
        pieces.add(new Span(i, i + 1));
      }
      return pieces;
    }
    int from = range.start();
    int hit = indexOf(text, separator, from, range.end());
    while (hit >= 0) {
      int cut = hit + separator.length();
      pieces.add(new Span(from, cut));
      from = cut;
      hit = indexOf(text, separator, from, range.end());
    }
    if (from < range.end()) {
      pieces.add(new Span(from, range.end()));
    }
    return pieces;
  }

  /** Greedy merge of contiguous pieces, keeping a trailing window of at most {@code overlap}. */
  private static List<Span> merge(List<Span> pieces, int chunkSize, int overlap) {
    List<Span> merged = new ArrayList<>();
    Deque<Span> window = new ArrayDeque<>();
    int total = 0;
    for (Span piece : pieces) {
      if (total + piece.length() > chunkSize && !window.isEmpty()) {
        merged.add(new Span(window.getFirst().start(), window.getLast().end()));
        while (total > overlap || (total + piece.length() > chunkSize && total > 0)) {
          total -= window.removeFirst().length();
        }
      }
      window.addLast(piece);
      total += piece.length();
    }
    if (!window.isEmpty()) {
      merged.add(new Span(window.getFirst().start(), window.getLast().end()));
    }
    return merged;
  }

  private static int indexOf(String text, String needle, int from, int to) {
    int hit = text.indexOf(needle, from);
    return hit >= 0 && hit + needle.length() <= to ? hit : -1;
  }

  private static int pageAt(String text, int offset) {
    int page = 1;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == PAGE_BREAK) {
        page++;
      }
    }
    return page;
  }

  private record Span(int start, int end) {
    int length() {
      return end - start;
    }
  }
}
