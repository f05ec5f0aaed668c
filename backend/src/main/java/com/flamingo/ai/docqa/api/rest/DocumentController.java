package com.flamingo.ai.docqa.api.rest;

import com.flamingo.ai.docqa.api.dto.request.CreateDocumentRequest;
import com.flamingo.ai.docqa.api.dto.response.DocumentResponse;
import com.flamingo.ai.docqa.api.dto.response.IngestionResponse;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.service.document.DocumentService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document management. The owner comes from the X-Owner-Id header. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  static final String OWNER_HEADER = "X-Owner-Id";

  private final DocumentService documentService;

  /** Stores a text document; indexing continues in the background. */
  @PostMapping
  public ResponseEntity<DocumentResponse> createDocument(
      @RequestHeader(OWNER_HEADER) String ownerId,
      @Valid @RequestBody CreateDocumentRequest request) {
    Document document =
        documentService.createDocument(ownerId, request.getName(), request.getText());
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  @GetMapping
  public ResponseEntity<List<DocumentResponse>> getDocuments(
      @RequestHeader(OWNER_HEADER) String ownerId) {
    List<DocumentResponse> responses =
        documentService.getDocuments(ownerId).stream().map(DocumentResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a document, including its indexing status. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable UUID documentId) {
    return ResponseEntity.ok(
        DocumentResponse.fromEntity(documentService.getDocument(ownerId, documentId)));
  }

  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable UUID documentId) {
    documentService.deleteDocument(ownerId, documentId);
    return ResponseEntity.noContent().build();
  }

  /** Re-indexes a document synchronously. */
  @PostMapping("/{documentId}/reindex")
  public ResponseEntity<IngestionResponse> reindexDocument(
      @RequestHeader(OWNER_HEADER) String ownerId, @PathVariable UUID documentId) {
    return ResponseEntity.ok(
        IngestionResponse.fromResult(documentService.reindexDocument(ownerId, documentId)));
  }

  /** Re-embeds documents indexed with the offline fallback embedder. */
  @PostMapping("/reembed")
  public ResponseEntity<List<IngestionResponse>> reembedDegraded(
      @RequestHeader(OWNER_HEADER) String ownerId) {
    return ResponseEntity.ok(
        documentService.reembedDegraded(ownerId).stream()
            .map(IngestionResponse::fromResult)
            .toList());
  }
}
