package com.flamingo.ai.docqa.service.rag.fusion;

/** Which rankings a fused candidate appeared in. */
public enum MatchType {
  SEMANTIC,
  LEXICAL,
  HYBRID
}
