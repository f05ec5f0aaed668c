package com.flamingo.ai.docqa.api.rest;

import com.flamingo.ai.docqa.api.dto.request.HistoryTurnRequest;
import com.flamingo.ai.docqa.api.dto.request.RagQueryRequest;
import com.flamingo.ai.docqa.api.dto.response.RagAnswerResponse;
import com.flamingo.ai.docqa.service.query.RagAnswer;
import com.flamingo.ai.docqa.service.query.RagQuery;
import com.flamingo.ai.docqa.service.query.RagQueryService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for question answering. */
@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
@Slf4j
public class RagController {

  private final RagQueryService ragQueryService;

  /**
   * Answers a question over the owner's documents.
   *
   * @param ownerId owner from the X-Owner-Id header
   * @param request the question with optional history and generation parameters
   * @return the answer with its cited sources
   */
  @PostMapping("/query")
  public ResponseEntity<RagAnswerResponse> query(
      @RequestHeader(DocumentController.OWNER_HEADER) String ownerId,
      @Valid @RequestBody RagQueryRequest request) {
    log.debug("Received query from owner {}", ownerId);
    List<HistoryTurnRequest> history =
        request.getHistory() == null ? List.of() : request.getHistory();
    RagAnswer answer =
        ragQueryService.answer(
            new RagQuery(
                ownerId,
                request.getQuery(),
                request.getTopK(),
                request.getDocumentId(),
                history.stream().map(HistoryTurnRequest::toTurn).toList(),
                request.getTemperature(),
                request.getMaxTokens()));
    return ResponseEntity.ok(RagAnswerResponse.fromAnswer(answer));
  }
}
