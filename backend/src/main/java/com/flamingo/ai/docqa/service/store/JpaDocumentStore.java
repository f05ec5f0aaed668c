package com.flamingo.ai.docqa.service.store;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import com.flamingo.ai.docqa.service.rag.lexical.TextTokenizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link DocumentStore} over {@link DocumentRepository}. Free-text ranking counts query-term
 * occurrences in the document name and text.
 */
@Component
@RequiredArgsConstructor
public class JpaDocumentStore implements DocumentStore {

  private final DocumentRepository documentRepository;

  @Override
  @Transactional(readOnly = true)
  public Optional<Document> get(String ownerId, UUID documentId) {
    return documentRepository.findByIdAndOwnerId(documentId, ownerId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> listByOwner(String ownerId) {
    return documentRepository.findByOwnerIdOrderByUploadedAtDesc(ownerId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> freeTextSearch(String ownerId, String query, int limit) {
    Set<String> terms = new HashSet<>(TextTokenizer.tokenize(query));
    if (terms.isEmpty() || limit <= 0) {
      return List.of();
    }
    List<ScoredDocument> scored = new ArrayList<>();
    for (Document document : documentRepository.findByOwnerIdOrderByUploadedAtDesc(ownerId)) {
      int hits = countHits(terms, document.getName()) + countHits(terms, document.getRawText());
      if (hits > 0) {
        scored.add(new ScoredDocument(document, hits));
      }
    }
    return scored.stream()
        .sorted(Comparator.comparingInt(ScoredDocument::hits).reversed())
        .limit(limit)
        .map(ScoredDocument::document)
        .toList();
  }

  private static int countHits(Set<String> terms, String text) {
    int hits = 0;
    for (String token : TextTokenizer.tokenize(text)) {
      if (terms.contains(token)) {
        hits++;
      }
    }
    return hits;
  }

  private record ScoredDocument(Document document, int hits) {}
}
