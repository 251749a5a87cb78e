package com.flamingo.ai.deepresearch.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.deepresearch.api.rest.HistoryController;
import com.flamingo.ai.deepresearch.api.sse.ResearchController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the HTTP surface:
 *
 * <ul>
 *   <li>POST /api/research - Start research in the background
 *   <li>POST /api/research/stream - Start research with SSE progress
 *   <li>GET /api/research/{sessionId} - Session snapshot
 *   <li>POST /api/research/{sessionId}/cancel - Cancel a session
 *   <li>GET /api/history - Recent stored sessions
 *   <li>GET /api/history/similar - Similar stored sessions
 *   <li>GET /api/history/stats - Store statistics
 *   <li>GET /api/history/{sessionId} - Stored session
 * </ul>
 */
class ApiContractTest {

  private static Method method(Class<?> type, String name) {
    return Arrays.stream(type.getDeclaredMethods())
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow();
  }

  @Nested
  @DisplayName("ResearchController API contract")
  class ResearchControllerContract {

    @Test
    @DisplayName("should be mapped to /api/research")
    void shouldBeMappedToApiResearch() {
      RequestMapping mapping = ResearchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/research");
    }

    @Test
    @DisplayName("should stream under /stream as text/event-stream")
    void shouldStreamServerSentEvents() {
      PostMapping mapping =
          method(ResearchController.class, "streamResearch").getAnnotation(PostMapping.class);
      assertThat(mapping.value()).containsExactly("/stream");
      assertThat(mapping.produces()).containsExactly(MediaType.TEXT_EVENT_STREAM_VALUE);
    }

    @Test
    @DisplayName("should expose session lookup and cancellation by id")
    void shouldExposeSessionEndpoints() {
      assertThat(
              method(ResearchController.class, "getSession")
                  .getAnnotation(GetMapping.class)
                  .value())
          .containsExactly("/{sessionId}");
      assertThat(
              method(ResearchController.class, "cancelSession")
                  .getAnnotation(PostMapping.class)
                  .value())
          .containsExactly("/{sessionId}/cancel");
    }
  }

  @Nested
  @DisplayName("HistoryController API contract")
  class HistoryControllerContract {

    @Test
    @DisplayName("should be mapped to /api/history")
    void shouldBeMappedToApiHistory() {
      RequestMapping mapping = HistoryController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/history");
    }

    @Test
    @DisplayName("should expose similar, stats and lookup endpoints")
    void shouldExposeQueryEndpoints() {
      assertThat(getPath("findSimilar")).containsExactly("/similar");
      assertThat(getPath("getStats")).containsExactly("/stats");
      assertThat(getPath("getRecord")).containsExactly("/{sessionId}");
    }

    private String[] getPath(String name) {
      return method(HistoryController.class, name).getAnnotation(GetMapping.class).value();
    }
  }
}
