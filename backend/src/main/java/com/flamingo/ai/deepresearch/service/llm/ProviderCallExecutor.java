package com.flamingo.ai.deepresearch.service.llm;

import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.exception.EmbeddingException;
import com.flamingo.ai.deepresearch.exception.LlmServiceException;
import com.flamingo.ai.deepresearch.exception.ProviderException;
import com.flamingo.ai.deepresearch.exception.ProviderException.Reason;
import com.flamingo.ai.deepresearch.exception.SearchException;
import dev.langchain4j.exception.RateLimitException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Runs calls to external providers under a per-call timeout and a retry budget.
 *
 * <p>Only retryable {@link ProviderException}s are retried. A timed-out attempt counts as a
 * retryable {@code TIMEOUT} failure. Any other exception thrown by the call is translated to the
 * {@link ProviderException} subclass of its {@link ProviderKind}.
 */
@Component
@Slf4j
public class ProviderCallExecutor {

  private final RetryRegistry retryRegistry;
  private final TimeLimiter timeLimiter;
  private final ExecutorService executor;
  private final MeterRegistry meterRegistry;

  public ProviderCallExecutor(
      ResearchConfig researchConfig,
      @Qualifier("providerCallExecutor") ExecutorService executor,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;

    ResearchConfig.Retry retry = researchConfig.getRetry();
    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, retry.getMaxAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    retry.getInitialBackoff(), retry.getBackoffMultiplier()))
            .retryOnException(
                e -> e instanceof ProviderException pe && pe.isRetryable())
            .failAfterMaxAttempts(false)
            .build();
    this.retryRegistry = RetryRegistry.of(retryConfig);
    this.retryRegistry
        .getEventPublisher()
        .onEntryAdded(
            added ->
                added
                    .getAddedEntry()
                    .getEventPublisher()
                    .onRetry(
                        event -> {
                          log.warn(
                              "Retrying {} (attempt {}) after: {}",
                              event.getName(),
                              event.getNumberOfRetryAttempts(),
                              event.getLastThrowable() != null
                                  ? event.getLastThrowable().getMessage()
                                  : "unknown error");
                          meterRegistry
                              .counter("research.provider.retries", "operation", event.getName())
                              .increment();
                        }));

    this.timeLimiter =
        TimeLimiter.of(
            "provider-call",
            TimeLimiterConfig.custom()
                .timeoutDuration(researchConfig.getCallTimeout())
                .cancelRunningFuture(true)
                .build());
  }

  /**
   * Executes {@code call} with timeout and retry.
   *
   * @param operation name used for logs, metrics and the retry instance, e.g. {@code "search"}
   * @param kind provider family, decides the exception type of translated failures
   * @return the call's result
   * @throws ProviderException once the retry budget is exhausted or on a non-retryable failure
   */
  public <T> T call(String operation, ProviderKind kind, Callable<T> call) {
    Retry retry = retryRegistry.retry(operation);
    try {
      return Retry.decorateCallable(retry, () -> attempt(operation, kind, call)).call();
    } catch (ProviderException e) {
      meterRegistry.counter("research.provider.failures", "operation", operation).increment();
      throw e;
    } catch (Exception e) {
      throw translate(operation, kind, e);
    }
  }

  private <T> T attempt(String operation, ProviderKind kind, Callable<T> call) {
    try {
      return timeLimiter.executeFutureSupplier(
          () ->
              CompletableFuture.supplyAsync(
                  () -> {
                    try {
                      return call.call();
                    } catch (RuntimeException e) {
                      throw e;
                    } catch (Exception e) {
                      throw new CompletionException(e);
                    }
                  },
                  executor));
    } catch (TimeoutException e) {
      throw failure(
          kind,
          operation + " timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(),
          Reason.TIMEOUT,
          e);
    } catch (ProviderException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw failure(kind, operation + " was interrupted", Reason.UNAVAILABLE, e);
    } catch (Exception e) {
      throw translate(operation, kind, e);
    }
  }

  private ProviderException translate(String operation, ProviderKind kind, Exception e) {
    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    if (cause instanceof ProviderException pe) {
      return pe;
    }
    Reason reason = isRateLimit(cause) ? Reason.RATE_LIMITED : Reason.UNAVAILABLE;
    return failure(kind, operation + " failed: " + cause.getMessage(), reason, cause);
  }

  private static boolean isRateLimit(Throwable cause) {
    return cause instanceof RateLimitException
        || (cause instanceof WebClientResponseException wce
            && wce.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value());
  }

  private static ProviderException failure(
      ProviderKind kind, String message, Reason reason, Throwable cause) {
    return switch (kind) {
      case LLM -> new LlmServiceException(message, reason, cause);
      case SEARCH -> new SearchException(message, reason, cause);
      case EMBEDDING -> new EmbeddingException(message, reason, cause);
    };
  }
}
