package com.flamingo.ai.docqa.service.rag.context;

import com.flamingo.ai.docqa.service.rag.fusion.Candidate;
import java.util.List;

/**
 * Prompt context and the candidates it contains. Candidate {@code i} in {@link #included()} is
 * cited as {@code [i + 1]}.
 */
public record AssembledContext(String text, List<Candidate> included) {

  public static AssembledContext empty() {
    return new AssembledContext("", List.of());
  }

  public boolean isEmpty() {
    return included.isEmpty();
  }
}
