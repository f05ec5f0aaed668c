package com.flamingo.ai.docqa.service.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import com.flamingo.ai.docqa.service.document.DocumentIngestionService;
import com.flamingo.ai.docqa.service.document.IngestionResult;
import com.flamingo.ai.docqa.service.rag.chunking.RecursiveCharacterChunker;
import com.flamingo.ai.docqa.service.rag.context.ContextAssembler;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingProvider;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.fusion.Candidate;
import com.flamingo.ai.docqa.service.rag.fusion.ReciprocalRankFusion;
import com.flamingo.ai.docqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docqa.service.rag.generation.LanguageModelProvider;
import com.flamingo.ai.docqa.service.rag.lexical.LexicalIndexService;
import com.flamingo.ai.docqa.service.rag.lexical.TextTokenizer;
import com.flamingo.ai.docqa.service.rag.provider.ProviderRetryExecutor;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalOrchestrator;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalRequest;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalResult;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievalTier;
import com.flamingo.ai.docqa.service.rag.vector.VectorIndexService;
import com.flamingo.ai.docqa.service.store.DocumentStore;
import com.flamingo.ai.docqa.service.store.InMemoryChunkStore;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Wires the real pipeline components with a word-count embedder and a mocked chat model. */
class RagPipelineEndToEndTest {

  private static final String TEXT =
      "Paris is the capital of France.\n\nThe Eiffel Tower is in Paris.";

  private static final List<String> VOCABULARY =
      List.of("paris", "capital", "france", "eiffel", "tower", "what", "is", "the", "of", "in");

  /** One dimension per vocabulary word, counting occurrences. */
  static class BagOfWordsProvider implements EmbeddingProvider {

    @Override
    public String modelId() {
      return "bag-of-words";
    }

    @Override
    public int dimension() {
      return VOCABULARY.size();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
      List<float[]> vectors = new ArrayList<>(texts.size());
      for (String text : texts) {
        float[] vector = new float[VOCABULARY.size()];
        for (String token : TextTokenizer.tokenize(text)) {
          int index = VOCABULARY.indexOf(token);
          if (index >= 0) {
            vector[index]++;
          }
        }
        vectors.add(vector);
      }
      return vectors;
    }
  }

  private ExecutorService executor;
  private DocumentRepository documentRepository;
  private LanguageModelProvider languageModelProvider;
  private DocumentIngestionService ingestionService;
  private RagQueryServiceImpl queryService;
  private RetrievalOrchestrator orchestrator;
  private EmbeddingService embeddingService;
  private RagConfig ragConfig;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getChunking().setSize(40);
    ragConfig.getChunking().setOverlap(0);
    ragConfig.getEmbedding().setDimensions(VOCABULARY.size());
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newFixedThreadPool(2);

    ProviderRetryExecutor retryExecutor =
        new ProviderRetryExecutor(ragConfig.getRetry(), meterRegistry);
    embeddingService =
        new EmbeddingService(
            List.of(new BagOfWordsProvider()), retryExecutor, executor, ragConfig, meterRegistry);
    InMemoryChunkStore chunkStore = new InMemoryChunkStore();
    VectorIndexService vectorIndexService =
        new VectorIndexService(chunkStore, Optional.empty(), meterRegistry);
    LexicalIndexService lexicalIndexService =
        new LexicalIndexService(chunkStore, ragConfig, meterRegistry);
    RecursiveCharacterChunker chunker = new RecursiveCharacterChunker();

    documentRepository = mock(DocumentRepository.class);
    when(documentRepository.save(any(Document.class))).thenAnswer(i -> i.getArgument(0));
    ingestionService =
        new DocumentIngestionService(
            documentRepository,
            chunkStore,
            chunker,
            embeddingService,
            vectorIndexService,
            lexicalIndexService,
            ragConfig,
            meterRegistry);

    orchestrator =
        new RetrievalOrchestrator(
            vectorIndexService,
            lexicalIndexService,
            new ReciprocalRankFusion(ragConfig),
            mock(DocumentStore.class),
            chunker,
            embeddingService,
            ragConfig,
            meterRegistry);

    languageModelProvider = mock(LanguageModelProvider.class);
    when(languageModelProvider.complete(anyList(), anyString(), any()))
        .thenReturn("Paris is the capital of France [1].");
    AnswerGenerator answerGenerator =
        new AnswerGenerator(
            languageModelProvider,
            retryExecutor,
            TimeLimiter.ofDefaults(),
            executor,
            ragConfig,
            meterRegistry);

    queryService =
        new RagQueryServiceImpl(
            embeddingService,
            ingestionService,
            orchestrator,
            new ContextAssembler(ragConfig),
            answerGenerator,
            ragConfig,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private UUID ingest(String owner, String name, String text) {
    Document document =
        Document.builder().id(UUID.randomUUID()).ownerId(owner).name(name).rawText(text).build();
    when(documentRepository.findByIdAndOwnerId(document.getId(), owner))
        .thenReturn(Optional.of(document));
    IngestionResult result = ingestionService.indexDocument(owner, document.getId());
    assertThat(result.indexedChunks()).isEqualTo(2);
    return document.getId();
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldAnswerFromTheMatchingChunk_withCitation() {
    ingest("alice", "atlas.txt", TEXT);

    RagAnswer answer = queryService.answer(RagQuery.of("alice", "What is the capital of France?"));

    assertThat(answer.grounded()).isTrue();
    assertThat(answer.lowConfidence()).isFalse();
    assertThat(answer.tier()).isEqualTo(RetrievalTier.LOCAL_SIMILARITY);
    assertThat(answer.answerText()).contains("[1]");
    assertThat(answer.sources()).hasSize(2);
    assertThat(answer.sources().get(0).preview()).isEqualTo("Paris is the capital of France.");
    assertThat(answer.sources().get(0).documentName()).isEqualTo("atlas.txt");

    ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
    verify(languageModelProvider).complete(messages.capture(), anyString(), any());
    String prompt = ((UserMessage) messages.getValue().get(1)).singleText();
    assertThat(prompt)
        .startsWith("Context:\n[1] atlas.txt (page 1, chunk 0)\nParis is the capital of France.")
        .contains("[2] atlas.txt (page 1, chunk 1)\nThe Eiffel Tower is in Paris.")
        .endsWith("Question: What is the capital of France?");
  }

  @Test
  void shouldRankMatchingChunkFirst_withFusedScoreAboveLexicalAlone() {
    ingest("alice", "atlas.txt", TEXT);
    String question = "What is the capital of France?";

    RetrievalResult result =
        orchestrator.retrieve(
            new RetrievalRequest(
                "alice", question, embeddingService.embedQuery(question), 1, null));

    assertThat(result.candidates()).hasSize(1);
    Candidate top = result.candidates().get(0);
    assertThat(top.getChunkIndex()).isZero();
    assertThat(top.getSemanticScore()).isCloseTo(5.0 / 6.0, within(1e-4));
    double lexicalOnly = 1.0 / (ragConfig.getRetrieval().getRrfK() + 1);
    assertThat(top.getFusedScore()).isGreaterThan(lexicalOnly);
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldAnswerWithoutContext_whenOwnerHasNoDocuments() {
    ingest("alice", "atlas.txt", TEXT);

    RagAnswer answer = queryService.answer(RagQuery.of("bob", "What is the capital of France?"));

    assertThat(answer.grounded()).isFalse();
    assertThat(answer.sources()).isEmpty();
    assertThat(answer.tier()).isEqualTo(RetrievalTier.EMPTY);

    ArgumentCaptor<List<ChatMessage>> messages = ArgumentCaptor.forClass(List.class);
    verify(languageModelProvider).complete(messages.capture(), anyString(), any());
    assertThat(((SystemMessage) messages.getValue().get(0)).text())
        .contains("No supporting passages were found");
    assertThat(((UserMessage) messages.getValue().get(1)).singleText())
        .doesNotContain("Paris is the capital");
  }
}
