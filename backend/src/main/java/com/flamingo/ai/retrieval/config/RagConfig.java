package com.flamingo.ai.retrieval.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Configuration properties for the retrieval pipeline. */
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Retrieval retrieval = new Retrieval();
  private Bm25 bm25 = new Bm25();
  private Reranking reranking = new Reranking();
  private Diversity diversity = new Diversity();
  private Cache cache = new Cache();
  private Embedding embedding = new Embedding();

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 6;
    private int maxTopK = 20;

    /** Over-fetch factor applied when reranking or MMR will downselect later. */
    private int candidatesMultiplier = 3;

    private int rrfK = 60;

    /** Base cosine threshold for semantic-only retrieval. */
    private double minSimilarityScore = 0.3;

    /** Top score above which the stricter threshold applies. */
    private double highConfidenceScore = 0.7;

    private double strictThreshold = 0.5;

    /** Top score below which the lenient threshold applies. */
    private double lowConfidenceScore = 0.4;

    private double lenientThreshold = 0.2;
  }

  /** Okapi BM25 constants. */
  @Getter
  @Setter
  public static class Bm25 {
    private double k1 = 1.5;
    private double b = 0.75;

    /** Floor for non-positive IDF values, as a fraction of the average IDF. */
    private double epsilon = 0.25;
  }

  @Getter
  @Setter
  public static class Reranking {
    private boolean enabled = true;

    /** Reranked chunks kept when MMR still has to downselect afterwards. */
    private int maxCandidates = 10;

    /** Default deadline for one reranker call. */
    private long timeoutMs = 10000;

    private Tei tei = new Tei();

    /** Configuration for the TEI (Text Embeddings Inference) cross-encoder endpoint. */
    @Getter
    @Setter
    public static class Tei {
      private String baseUrl = "http://localhost:8090";
      private String modelId = "cross-encoder/ms-marco-MiniLM-L-6-v2";
      private boolean truncate = true;
      private boolean rawScores = false;
      private int readTimeoutMs = 10000;
    }
  }

  @Getter
  @Setter
  public static class Diversity {
    /** MMR trade-off: 1.0 is pure relevance, 0.0 is pure novelty. */
    private double lambda = 0.7;
  }

  @Getter
  @Setter
  public static class Cache {
    private int maxSize = 500;
    private Duration ttl = Duration.ofHours(24);
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Vector dimension shared by the query embedder and every stored chunk. */
    private int dimension = 384;
  }
}
