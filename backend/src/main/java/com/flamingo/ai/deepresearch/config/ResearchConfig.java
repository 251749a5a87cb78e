package com.flamingo.ai.deepresearch.config;

import com.flamingo.ai.deepresearch.domain.enums.LlmProvider;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the research loop, its providers and the history store. */
@Configuration
@ConfigurationProperties(prefix = "research")
@Getter
@Setter
public class ResearchConfig {

  /** Default loop budget for a session (1-10). */
  private int maxLoops = 3;

  private SearchApi searchApi = SearchApi.DUCKDUCKGO;

  /** Include the full page text of each result, not just the snippet. */
  private boolean fetchFullPage = true;

  private int resultsPerQuery = 3;

  /** Upper bound of page text handed to the summarizer per source. */
  private int maxCharsPerSource = 4000;

  /** Ask the LLM to refine the topic into the first search query. */
  private boolean generateInitialQuery = true;

  /** Remove {@code <think>} blocks emitted by reasoning models. */
  private boolean stripThinkingTokens = true;

  /** Per-call timeout for search, summarize, reflect and embed calls. */
  private Duration callTimeout = Duration.ofSeconds(60);

  private Retry retry = new Retry();
  private Dedup dedup = new Dedup();
  private Embedding embedding = new Embedding();
  private History history = new History();
  private Search search = new Search();
  private Llm llm = new Llm();
  private Sessions sessions = new Sessions();

  @Getter
  @Setter
  public static class Retry {
    /** Total attempts per provider call; 2 means one retry. */
    private int maxAttempts = 2;

    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Dedup {
    /** Number of leading content characters mixed into the fingerprint. */
    private int fingerprintContentChars = 500;

    /** Relevance scorer: "lexical" (default) or "embedding". */
    private String scoring = "lexical";
  }

  @Getter
  @Setter
  public static class Embedding {
    private String modelName = "text-embedding-3-small";

    /** Vector dimension fixed for the lifetime of the history store. */
    private int dimension = 1536;

    /** Longest text sent to the embedding model. */
    private int maxInputChars = 5000;
  }

  @Getter
  @Setter
  public static class History {
    /** Save every completed session to the history store. */
    private boolean autoSave = true;

    private int recentLimit = 10;
  }

  @Getter
  @Setter
  public static class Search {
    private String userAgent = "Mozilla/5.0 (compatible; DeepResearch/0.1)";
    private int maxResponseBytes = 4 * 1024 * 1024;

    /** Time allowed for downloading a single result page; kept well below the call timeout. */
    private Duration pageFetchTimeout = Duration.ofSeconds(10);

    private int pageFetchConcurrency = 4;
    private Tavily tavily = new Tavily();
    private Searxng searxng = new Searxng();
    private DuckDuckGo duckduckgo = new DuckDuckGo();

    @Getter
    @Setter
    public static class Tavily {
      private String baseUrl = "https://api.tavily.com";
      private String apiKey;
    }

    @Getter
    @Setter
    public static class Searxng {
      private String baseUrl = "http://localhost:8888";
    }

    @Getter
    @Setter
    public static class DuckDuckGo {
      private String baseUrl = "https://html.duckduckgo.com";
    }
  }

  @Getter
  @Setter
  public static class Llm {
    private LlmProvider provider = LlmProvider.OPENAI;

    /** Model used for Ollama and LM Studio; OpenAI uses langchain4j.openai.* settings. */
    private String modelName = "gemma3:latest";

    private String ollamaBaseUrl = "http://localhost:11434/";
    private String lmstudioBaseUrl = "http://localhost:1234/v1";
  }

  @Getter
  @Setter
  public static class Sessions {
    /** Finished sessions kept in memory for status lookups. */
    private int retainFinished = 100;
  }
}
