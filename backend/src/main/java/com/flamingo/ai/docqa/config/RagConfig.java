package com.flamingo.ai.docqa.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval and generation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Retry retry = new Retry();
  private Retrieval retrieval = new Retrieval();
  private Vector vector = new Vector();
  private Lexical lexical = new Lexical();
  private Context context = new Context();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Chunking {
    private int size = 1000;
    private int overlap = 150;
  }

  @Getter
  @Setter
  public static class Embedding {
    private int batchSize = 64;

    /** Upper bound on embedding batches in flight for one call. */
    private int maxConcurrentBatches = 2;

    private int maxCharsPerText = 5000;

    /** Dimension of the primary model; the hash fallback produces vectors of the same size. */
    private int dimensions = 1536;

    /** Optional second OpenAI embedding model tried before the hash fallback. */
    private String secondaryModelName;

    private boolean hashFallbackEnabled = true;
  }

  /** Backoff applied to rate-limited and transient provider calls. */
  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private long initialIntervalMs = 2000;
    private double multiplier = 2.0;
    private long maxIntervalMs = 15000;
    private double randomizationFactor = 0.15;

    /** Total sleep allowed across all attempts of a single call. */
    private long maxTotalDelayMs = 30000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private int rrfK = 60;
    private int candidatesMultiplier = 4;

    /** Minimum cosine similarity of the best candidate for a tier to be accepted. */
    private double confidenceThreshold = 0.2;

    /** Documents shortlisted by free-text search in the last retrieval tier. */
    private int prefilterDocumentLimit = 3;
  }

  @Getter
  @Setter
  public static class Vector {
    private boolean nativeEnabled = false;
    private String indexName = "docqa-chunks";
    private int numCandidates = 200;
  }

  @Getter
  @Setter
  public static class Lexical {
    private double k1 = 1.2;
    private double b = 0.75;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxChars = 12000;
  }

  @Getter
  @Setter
  public static class Generation {
    private String primaryModel = "gpt-4o-mini";
    private List<String> fallbackModels = new ArrayList<>();
    private int historyTurns = 8;
    private int timeoutSeconds = 30;
    private double temperature = 0.2;
    private int maxTokens = 1024;
    private int previewChars = 300;

    /** Primary model followed by the fallbacks, without duplicates. */
    public List<String> modelChain() {
      List<String> chain = new ArrayList<>();
      chain.add(primaryModel);
      for (String model : fallbackModels) {
        if (model != null && !model.isBlank() && !chain.contains(model.trim())) {
          chain.add(model.trim());
        }
      }
      return chain;
    }
  }
}
