package com.flamingo.ai.docqa.service.query;

/** Answers questions over an owner's documents. */
public interface RagQueryService {

  /**
   * Runs retrieval and generation for one question.
   *
   * @throws com.flamingo.ai.docqa.exception.RagValidationException for a blank query or a
   *     non-positive topK
   * @throws com.flamingo.ai.docqa.exception.RagPipelineException when every provider fallback is
   *     exhausted
   */
  RagAnswer answer(RagQuery query);
}
