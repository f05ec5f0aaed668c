package com.flamingo.ai.docqa.service.store;

import com.flamingo.ai.docqa.domain.entity.Document;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Read access to the documents an owner has ingested. */
public interface DocumentStore {

  Optional<Document> get(String ownerId, UUID documentId);

  List<Document> listByOwner(String ownerId);

  /**
   * Ranks the owner's documents against a free-text query and returns the best matches.
   *
   * @param ownerId owner whose documents are searched
   * @param query free text
   * @param limit maximum number of documents
   * @return matching documents, best first; never documents of another owner
   */
  List<Document> freeTextSearch(String ownerId, String query, int limit);
}
