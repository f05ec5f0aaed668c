package com.flamingo.ai.docqa.service.query;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.RagPipelineException;
import com.flamingo.ai.docqa.exception.RagValidationException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import com.flamingo.ai.docqa.service.document.DocumentIngestionService;
import com.flamingo.ai.docqa.service.rag.context.AssembledContext;
import com.flamingo.ai.docqa.service.rag.context.ContextAssembler;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.embedding.QueryEmbedding;
import com.flamingo.ai.docqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docqa.service.rag.generation.GeneratedAnswer;
import com.flamingo.ai.docqa.service.rag.generation.GenerationOptions;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalOrchestrator;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalRequest;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Query pipeline: embed the question, bring stale documents up to date, retrieve, assemble the
 * context and generate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RagQueryServiceImpl implements RagQueryService {

  private final EmbeddingService embeddingService;
  private final DocumentIngestionService ingestionService;
  private final RetrievalOrchestrator retrievalOrchestrator;
  private final ContextAssembler contextAssembler;
  private final AnswerGenerator answerGenerator;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.query", description = "Time to answer a question")
  public RagAnswer answer(RagQuery query) {
    int topK = validate(query);
    log.info("Answering query for owner {} (topK={})", query.ownerId(), topK);

    try {
      QueryEmbedding queryEmbedding = embeddingService.embedQuery(query.query());
      ingestionService.ensureIndexed(query.ownerId(), queryEmbedding);

      RetrievalResult retrieval =
          retrievalOrchestrator.retrieve(
              new RetrievalRequest(
                  query.ownerId(), query.query(), queryEmbedding, topK, query.documentId()));
      AssembledContext context = contextAssembler.assemble(retrieval.candidates());
      if (context.isEmpty()) {
        log.info("No context for owner {}, answering in no-context mode", query.ownerId());
      }

      GeneratedAnswer generated =
          answerGenerator.generate(query.query(), context, query.history(), options(query));
      meterRegistry
          .counter(
              "rag.query",
              "tier",
              retrieval.tier().name(),
              "grounded",
              String.valueOf(generated.grounded()))
          .increment();
      return new RagAnswer(
          query.query(),
          generated.answerText(),
          generated.sources(),
          retrieval.tier(),
          generated.grounded(),
          generated.degraded(),
          retrieval.lowConfidence());
    } catch (TransientProviderException | ProviderUnavailableException e) {
      log.error(
          "Query for owner {} failed after exhausting provider fallbacks: {}",
          query.ownerId(),
          e.getMessage(),
          e);
      meterRegistry.counter("rag.query.failed").increment();
      throw new RagPipelineException("Query pipeline failed: " + e.getMessage(), e);
    }
  }

  private int validate(RagQuery query) {
    if (query.ownerId() == null || query.ownerId().isBlank()) {
      throw new RagValidationException("Owner id is required");
    }
    if (query.query() == null || query.query().isBlank()) {
      throw new RagValidationException("Query must not be blank");
    }
    int topK = query.topK() == null ? ragConfig.getRetrieval().getTopK() : query.topK();
    if (topK <= 0) {
      throw new RagValidationException("topK must be positive, got " + topK);
    }
    return topK;
  }

  private GenerationOptions options(RagQuery query) {
    RagConfig.Generation defaults = ragConfig.getGeneration();
    return new GenerationOptions(
        query.temperature() == null ? defaults.getTemperature() : query.temperature(),
        query.maxTokens() == null ? defaults.getMaxTokens() : query.maxTokens());
  }
}
