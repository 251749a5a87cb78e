package com.flamingo.ai.deepresearch.service.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.EmbeddingException;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import com.flamingo.ai.deepresearch.exception.ProviderException;
import com.flamingo.ai.deepresearch.exception.ProviderException.Reason;
import com.flamingo.ai.deepresearch.exception.SearchException;
import dev.langchain4j.exception.RateLimitException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProviderCallExecutorTest {

  private ExecutorService executorService;
  private SimpleMeterRegistry meterRegistry;
  private ProviderCallExecutor providerCallExecutor;

  @BeforeEach
  void setUp() {
    ResearchConfig config = new ResearchConfig();
    config.setCallTimeout(Duration.ofMillis(300));
    config.getRetry().setInitialBackoff(Duration.ofMillis(1));
    executorService = Executors.newCachedThreadPool();
    meterRegistry = new SimpleMeterRegistry();
    providerCallExecutor = new ProviderCallExecutor(config, executorService, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  @Test
  @DisplayName("should return the result of a successful call")
  void shouldReturnResult_whenCallSucceeds() {
    String result = providerCallExecutor.call("summarize", ProviderKind.LLM, () -> "summary");

    assertThat(result).isEqualTo("summary");
  }

  @Test
  @DisplayName("should retry a transient failure once")
  void shouldRetryOnce_whenFailureIsTransient() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        providerCallExecutor.call(
            "search",
            ProviderKind.SEARCH,
            () -> {
              if (attempts.incrementAndGet() == 1) {
                throw new SearchException("connection reset");
              }
              return "hits";
            });

    assertThat(result).isEqualTo("hits");
    assertThat(attempts).hasValue(2);
    assertThat(meterRegistry.counter("research.provider.retries", "operation", "search").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should give up after the second attempt")
  void shouldFail_whenRetryBudgetExhausted() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                providerCallExecutor.call(
                    "search",
                    ProviderKind.SEARCH,
                    () -> {
                      attempts.incrementAndGet();
                      throw new SearchException("down");
                    }))
        .isInstanceOf(SearchException.class)
        .hasMessage("down");
    assertThat(attempts).hasValue(2);
    assertThat(meterRegistry.counter("research.provider.failures", "operation", "search").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should not retry a malformed response")
  void shouldNotRetry_whenFailureNotRetryable() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                providerCallExecutor.call(
                    "reflect",
                    ProviderKind.LLM,
                    () -> {
                      attempts.incrementAndGet();
                      throw new LlmServiceException("bad", Reason.MALFORMED_RESPONSE, null);
                    }))
        .isInstanceOf(LlmServiceException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  @DisplayName("should translate a raw client exception to the provider kind")
  void shouldTranslateRawException_toProviderKind() {
    assertThatThrownBy(
            () ->
                providerCallExecutor.call(
                    "embed",
                    ProviderKind.EMBEDDING,
                    () -> {
                      throw new IllegalStateException("socket closed");
                    }))
        .isInstanceOf(EmbeddingException.class)
        .satisfies(
            e -> assertThat(((ProviderException) e).getReason()).isEqualTo(Reason.UNAVAILABLE))
        .hasMessageContaining("socket closed");
  }

  @Test
  @DisplayName("should mark a provider rate limit")
  void shouldMarkRateLimit_whenProviderThrottles() {
    assertThatThrownBy(
            () ->
                providerCallExecutor.call(
                    "summarize",
                    ProviderKind.LLM,
                    () -> {
                      throw new RateLimitException("429 Too Many Requests");
                    }))
        .isInstanceOf(LlmServiceException.class)
        .satisfies(e -> assertThat(((ProviderException) e).isRateLimited()).isTrue());
  }

  @Test
  @DisplayName("should turn a call exceeding the timeout into a retryable timeout failure")
  void shouldTimeout_whenCallTooSlow() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                providerCallExecutor.call(
                    "search",
                    ProviderKind.SEARCH,
                    () -> {
                      attempts.incrementAndGet();
                      Thread.sleep(5_000);
                      return "late";
                    }))
        .isInstanceOf(SearchException.class)
        .satisfies(e -> assertThat(((ProviderException) e).getReason()).isEqualTo(Reason.TIMEOUT));
    assertThat(attempts).hasValue(2);
  }
}
