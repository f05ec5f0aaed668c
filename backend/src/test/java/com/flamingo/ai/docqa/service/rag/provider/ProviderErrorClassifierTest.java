package com.flamingo.ai.docqa.service.rag.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docqa.exception.ProviderUnavailableException;
import com.flamingo.ai.docqa.exception.TransientProviderException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.ModelNotFoundException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProviderErrorClassifierTest {

  @Nested
  @DisplayName("HTTP status codes")
  class StatusCodes {

    @Test
    void shouldClassifyRateLimited_when429() {
      assertThat(ProviderErrorClassifier.classify(new HttpException(429, "slow down")))
          .isEqualTo(ProviderErrorType.RATE_LIMITED);
    }

    @Test
    void shouldClassifyTransient_when5xx() {
      assertThat(ProviderErrorClassifier.classify(new HttpException(503, "overloaded")))
          .isEqualTo(ProviderErrorType.TRANSIENT);
    }

    @Test
    void shouldClassifyUnavailable_whenUnauthorized() {
      assertThat(ProviderErrorClassifier.classify(new HttpException(401, "bad key")))
          .isEqualTo(ProviderErrorType.UNAVAILABLE);
    }

    @Test
    void shouldFindStatus_whenWrappedInCauseChain() {
      RuntimeException wrapped = new RuntimeException("call failed", new HttpException(429, "x"));

      assertThat(ProviderErrorClassifier.classify(wrapped))
          .isEqualTo(ProviderErrorType.RATE_LIMITED);
    }
  }

  @Nested
  @DisplayName("Exception types and messages")
  class TypesAndMessages {

    @Test
    void shouldClassifyUnavailable_whenModelNotFound() {
      assertThat(ProviderErrorClassifier.classify(new ModelNotFoundException("gone")))
          .isEqualTo(ProviderErrorType.UNAVAILABLE);
      assertThat(ProviderErrorClassifier.classify(new ProviderUnavailableException("m", "down")))
          .isEqualTo(ProviderErrorType.UNAVAILABLE);
    }

    @Test
    void shouldKeepRateLimitFlag_whenAlreadyTransientProviderException() {
      assertThat(
              ProviderErrorClassifier.classify(
                  new TransientProviderException("m", "limited", true, null)))
          .isEqualTo(ProviderErrorType.RATE_LIMITED);
    }

    @Test
    void shouldClassifyRateLimited_whenMessageMentionsQuota() {
      assertThat(ProviderErrorClassifier.classify(new IllegalStateException("Quota exceeded")))
          .isEqualTo(ProviderErrorType.RATE_LIMITED);
    }

    @Test
    void shouldClassifyUnavailable_whenMessageSaysModelDoesNotExist() {
      assertThat(
              ProviderErrorClassifier.classify(
                  new IllegalStateException("The model `gpt-x` does not exist")))
          .isEqualTo(ProviderErrorType.UNAVAILABLE);
    }

    @Test
    void shouldClassifyTransient_whenTimeout() {
      RuntimeException timeout =
          new UncheckedIOException(new SocketTimeoutException("read timed out"));

      assertThat(ProviderErrorClassifier.classify(timeout)).isEqualTo(ProviderErrorType.TRANSIENT);
    }
  }
}
