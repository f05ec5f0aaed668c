package com.flamingo.ai.docqa.exception;

import java.util.UUID;

/** Thrown when a document does not exist or is not visible to the requesting owner. */
public class DocumentNotFoundException extends RuntimeException {

  private final UUID documentId;

  public DocumentNotFoundException(UUID documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
