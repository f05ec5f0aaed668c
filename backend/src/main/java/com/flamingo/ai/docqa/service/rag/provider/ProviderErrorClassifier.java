package com.flamingo.ai.docqa.service.rag.provider;

import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.ModelNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Classifies provider failures by walking the cause chain: explicit exception types first, then
 * HTTP status codes, then message keywords. Unrecognised failures count as transient.
 */
public final class ProviderErrorClassifier {

  private static final int MAX_CHAIN_DEPTH = 20;

  private ProviderErrorClassifier() {}

  public static ProviderErrorType classify(Throwable error) {
    List<Throwable> chain = causeChain(error);

    for (Throwable t : chain) {
      if (t instanceof ProviderUnavailableException || t instanceof ModelNotFoundException) {
        return ProviderErrorType.UNAVAILABLE;
      }
      if (t instanceof TransientProviderException tpe) {
        return tpe.isRateLimited() ? ProviderErrorType.RATE_LIMITED : ProviderErrorType.TRANSIENT;
      }
    }

    for (Throwable t : chain) {
      if (t instanceof HttpException http) {
        int status = http.statusCode();
        if (status == 429) {
          return ProviderErrorType.RATE_LIMITED;
        }
        if (status >= 500) {
          return ProviderErrorType.TRANSIENT;
        }
        if (status == 408) {
          return ProviderErrorType.TRANSIENT;
        }
        if (status >= 400) {
          return ProviderErrorType.UNAVAILABLE;
        }
      }
    }

    String messages = joinedMessages(chain);
    if (messages.contains("rate limit")
        || messages.contains("rate_limit")
        || messages.contains("too many requests")
        || messages.contains("quota")
        || messages.contains("429")) {
      return ProviderErrorType.RATE_LIMITED;
    }
    if (messages.contains("does not exist")
        || messages.contains("model not found")
        || messages.contains("model_not_found")
        || messages.contains("no access")
        || messages.contains("404")
        || messages.contains("invalid api key")
        || messages.contains("incorrect api key")) {
      return ProviderErrorType.UNAVAILABLE;
    }
    // timeouts, I/O errors and anything unrecognised
    return ProviderErrorType.TRANSIENT;
  }

  private static List<Throwable> causeChain(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Throwable current = error;
    while (current != null && chain.size() < MAX_CHAIN_DEPTH) {
      chain.add(current);
      Throwable next = current.getCause();
      if (next == current) {
        break;
      }
      current = next;
    }
    return chain;
  }

  private static String joinedMessages(List<Throwable> chain) {
    StringBuilder sb = new StringBuilder();
    for (Throwable t : chain) {
      if (t.getMessage() != null) {
        sb.append(t.getMessage().toLowerCase(Locale.ROOT)).append(" | ");
      }
    }
    return sb.toString();
  }
}
