package com.flamingo.ai.docqa.service.rag.generation;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.RagPipelineException;
import com.flamingo.ai.docqa.service.rag.context.AssembledContext;
import com.flamingo.ai.docqa.service.rag.fusion.Candidate;
import com.flamingo.ai.docqa.service.rag.provider.ProviderRetryExecutor;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Produces the final answer from the assembled context.
 *
 * <p>Models are tried in configured order; a model reported unknown or inaccessible hands over to
 * the next one, while rate limits and transient errors are retried with backoff. The whole call
 * runs under a time limit, after which a degraded message is returned.
 */
@Service
@Slf4j
public class AnswerGenerator {

  static final String GROUNDED_INSTRUCTION =
      "You are a helpful assistant that answers questions about the user's documents. "
          + "Answer using only the numbered document excerpts provided in the context. "
          + "Cite the excerpts that support each statement with their numbers in square brackets, "
          + "for example [1] or [2][3]. If the excerpts do not contain the answer, say so plainly "
          + "instead of guessing. Be concise and accurate.";

  static final String NO_CONTEXT_INSTRUCTION =
      "You are a helpful assistant that answers questions about the user's documents. "
          + "No supporting passages were found in the user's documents for this question. "
          + "Start your answer by stating that no supporting context was found in the uploaded "
          + "documents. You may then give a brief general answer, clearly marked as not coming "
          + "from the documents. Do not include citations.";

  static final String TIMEOUT_MESSAGE =
      "Sorry, generating an answer took too long. Please try again in a moment.";

  private final LanguageModelProvider languageModelProvider;
  private final ProviderRetryExecutor retryExecutor;
  private final TimeLimiter timeLimiter;
  private final ExecutorService generationExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public AnswerGenerator(
      LanguageModelProvider languageModelProvider,
      ProviderRetryExecutor retryExecutor,
      @Qualifier("generationTimeLimiter") TimeLimiter timeLimiter,
      @Qualifier("generationExecutor") ExecutorService generationExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.languageModelProvider = languageModelProvider;
    this.retryExecutor = retryExecutor;
    this.timeLimiter = timeLimiter;
    this.generationExecutor = generationExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates an answer.
   *
   * @param question the user's question
   * @param context numbered context; empty switches to the no-context instruction
   * @param history earlier turns, oldest first; only the most recent ones are sent
   * @param options sampling parameters
   */
  @Timed(value = "rag.generation", description = "Time to generate an answer")
  public GeneratedAnswer generate(
      String question,
      AssembledContext context,
      List<ConversationTurn> history,
      GenerationOptions options) {
    boolean grounded = !context.isEmpty();
    List<ChatMessage> messages = buildMessages(question, context, history);
    List<SourceReference> sources = sources(context);

    long deadline =
        System.nanoTime() + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toNanos();
    BooleanSupplier expired = () -> System.nanoTime() - deadline >= 0;
    try {
      String answer =
          timeLimiter.executeFutureSupplier(
              () ->
                  generationExecutor.submit(
                      () -> completeWithFallback(messages, options, expired)));
      meterRegistry.counter("rag.generation", "grounded", String.valueOf(grounded)).increment();
      return new GeneratedAnswer(answer, sources, grounded, false);
    } catch (TimeoutException e) {
      log.warn(
          "Answer generation exceeded {}s, returning degraded answer",
          ragConfig.getGeneration().getTimeoutSeconds());
      meterRegistry.counter("rag.generation.timeout").increment();
      return new GeneratedAnswer(TIMEOUT_MESSAGE, sources, grounded, true);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new RagPipelineException("Answer generation failed: " + e.getMessage(), e);
    }
  }

  List<ChatMessage> buildMessages(
      String question, AssembledContext context, List<ConversationTurn> history) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(
        SystemMessage.from(context.isEmpty() ? NO_CONTEXT_INSTRUCTION : GROUNDED_INSTRUCTION));

    int keep = Math.max(0, ragConfig.getGeneration().getHistoryTurns());
    List<ConversationTurn> recent =
        history.subList(Math.max(0, history.size() - keep), history.size());
    for (ConversationTurn turn : recent) {
      if (turn.content() == null || turn.content().isBlank()) {
        continue;
      }
      messages.add(
          turn.role() == ConversationTurn.Role.ASSISTANT
              ? AiMessage.from(turn.content())
              : UserMessage.from(turn.content()));
    }

    String prompt =
        context.isEmpty()
            ? "Question: " + question
            : "Context:\n" + context.text() + "\n\nQuestion: " + question;
    messages.add(UserMessage.from(prompt));
    return messages;
  }

  private String completeWithFallback(
      List<ChatMessage> messages, GenerationOptions options, BooleanSupplier expired) {
    ProviderUnavailableException lastFailure = null;
    for (String model : ragConfig.getGeneration().modelChain()) {
      if (Thread.currentThread().isInterrupted() || expired.getAsBoolean()) {
        throw new RagPipelineException("Answer generation was cancelled", lastFailure);
      }
      try {
        String answer =
            retryExecutor.execute(
                model, () -> languageModelProvider.complete(messages, model, options), expired);
        log.debug("Answer generated with model {}", model);
        return answer;
      } catch (ProviderUnavailableException e) {
        log.warn("Model {} unavailable, trying next fallback: {}", model, e.getMessage());
        meterRegistry.counter("rag.generation.model_fallback", "model", model).increment();
        lastFailure = e;
      }
    }
    throw new ProviderUnavailableException(
        "generation", "No configured chat model is available", lastFailure);
  }

  private List<SourceReference> sources(AssembledContext context) {
    int previewChars = ragConfig.getGeneration().getPreviewChars();
    List<SourceReference> sources = new ArrayList<>(context.included().size());
    for (Candidate candidate : context.included()) {
      String text = candidate.getText();
      String preview =
          text.length() > previewChars ? text.substring(0, previewChars) + "..." : text;
      sources.add(
          new SourceReference(candidate.getChunkId(), candidate.getDocumentName(), preview));
    }
    return sources;
  }
}
