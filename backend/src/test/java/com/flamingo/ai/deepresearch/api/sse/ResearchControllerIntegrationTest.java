package com.flamingo.ai.deepresearch.api.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deepresearch.api.dto.request.StartResearchRequest;
import com.flamingo.ai.deepresearch.config.ResearchConfig;
import com.flamingo.ai.deepresearch.domain.enums.ResearchPhase;
import com.flamingo.ai.deepresearch.domain.enums.SearchApi;
import com.flamingo.ai.deepresearch.domain.enums.SessionStatus;
import com.flamingo.ai.deepresearch.domain.model.ResearchEvent;
import com.flamingo.ai.deepresearch.domain.model.ResearchOptions;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.exception.GlobalExceptionHandler;
import com.flamingo.ai.deepresearch.exception.ResearchSessionNotFoundException;
import com.flamingo.ai.deepresearch.service.research.ResearchSessionManager;
import com.flamingo.ai.deepresearch.service.research.ResearchSessionManager.ResearchStream;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Flux;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResearchController Integration Tests")
class ResearchControllerIntegrationTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @Mock private ResearchSessionManager sessionManager;
  private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    ResearchController controller =
        new ResearchController(sessionManager, new ResearchConfig(), meterRegistry);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static ResearchSession finishedSession(String topic) {
    ResearchSession session = ResearchSession.create(topic, 3);
    session.transitionTo(ResearchPhase.QUERYING);
    session.updateSummary("Prices fell.");
    session.completeIteration(1);
    session.finish(SessionStatus.COMPLETED, "## Summary\nPrices fell.");
    return session;
  }

  @Test
  @DisplayName("Should start research and return 202 with the running session")
  void shouldStartResearch() throws Exception {
    ResearchSession session = ResearchSession.create("solar 2024", 2);
    when(sessionManager.startAsync(eq("solar 2024"), any(ResearchOptions.class)))
        .thenReturn(session);
    StartResearchRequest request =
        StartResearchRequest.builder().topic("solar 2024").maxLoops(2).searchApi("tavily").build();

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.id").value(session.getId().toString()))
        .andExpect(jsonPath("$.topic").value("solar 2024"))
        .andExpect(jsonPath("$.status").value("RUNNING"))
        .andExpect(jsonPath("$.maxLoops").value(2));

    ArgumentCaptor<ResearchOptions> options = ArgumentCaptor.forClass(ResearchOptions.class);
    verify(sessionManager).startAsync(eq("solar 2024"), options.capture());
    assertThat(options.getValue().maxLoops()).isEqualTo(2);
    assertThat(options.getValue().searchApi()).isEqualTo(SearchApi.TAVILY);
  }

  @Test
  @DisplayName("Should reject a blank topic")
  void shouldRejectBlankTopic() throws Exception {
    StartResearchRequest request = StartResearchRequest.builder().topic(" ").build();

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(sessionManager, never()).startAsync(any(), any());
  }

  @Test
  @DisplayName("Should reject a loop budget above the maximum")
  void shouldRejectTooManyLoops() throws Exception {
    StartResearchRequest request =
        StartResearchRequest.builder().topic("solar").maxLoops(11).build();

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value(containsString("maxLoops")));
  }

  @Test
  @DisplayName("Should return 503 when no worker is free")
  void shouldReturnServiceUnavailable_whenRejected() throws Exception {
    when(sessionManager.startAsync(any(), any())).thenThrow(new TaskRejectedException("full"));
    StartResearchRequest request = StartResearchRequest.builder().topic("solar").build();

    mockMvc
        .perform(
            post("/api/research")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("SESSION_002"));
  }

  @Test
  @DisplayName("Should stream progress events followed by the report")
  void shouldStreamProgressAndReport() throws Exception {
    ResearchSession session = finishedSession("solar 2024");
    ResearchEvent event =
        new ResearchEvent(
            session.getId(),
            ResearchPhase.SEARCHING,
            SessionStatus.RUNNING,
            1,
            3,
            10.0,
            "Searching the web",
            Map.of(),
            Instant.now());
    when(sessionManager.startStreaming(eq("solar 2024"), any(ResearchOptions.class)))
        .thenReturn(new ResearchStream(session, Flux.just(event)));
    StartResearchRequest request = StartResearchRequest.builder().topic("solar 2024").build();

    MvcResult result =
        mockMvc
            .perform(
                post("/api/research/stream")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(request))
                    .accept(MediaType.TEXT_EVENT_STREAM))
            .andExpect(status().isOk())
            .andExpect(request().asyncStarted())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM))
            .andReturn();
    result.getAsyncResult();

    String body = result.getResponse().getContentAsString();
    assertThat(body).contains("\"eventType\":\"progress\"").contains("Searching the web");
    assertThat(body).contains("\"eventType\":\"report\"").contains("Prices fell.");
    assertThat(body.indexOf("progress")).isLessThan(body.indexOf("\"report\""));
  }

  @Test
  @DisplayName("Should get a session snapshot")
  void shouldGetSession() throws Exception {
    ResearchSession session = finishedSession("solar 2024");
    when(sessionManager.get(session.getId())).thenReturn(session);

    mockMvc
        .perform(get("/api/research/{sessionId}", session.getId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.loopCount").value(1))
        .andExpect(jsonPath("$.finalReport").value("## Summary\nPrices fell."));
  }

  @Test
  @DisplayName("Should return 404 for an unknown session")
  void shouldReturnNotFound_whenSessionUnknown() throws Exception {
    UUID sessionId = UUID.randomUUID();
    when(sessionManager.get(sessionId)).thenThrow(new ResearchSessionNotFoundException(sessionId));

    mockMvc
        .perform(get("/api/research/{sessionId}", sessionId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SESSION_001"))
        .andExpect(jsonPath("$.errorId").exists());
  }

  @Test
  @DisplayName("Should accept a cancellation request")
  void shouldCancelSession() throws Exception {
    ResearchSession session = ResearchSession.create("solar", 3);
    when(sessionManager.cancel(session.getId())).thenReturn(session);

    mockMvc
        .perform(post("/api/research/{sessionId}/cancel", session.getId()))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.id").value(session.getId().toString()));

    verify(sessionManager).cancel(session.getId());
  }

  @Test
  @DisplayName("Should return 400 for a malformed session id")
  void shouldReturnBadRequest_whenSessionIdMalformed() throws Exception {
    mockMvc
        .perform(get("/api/research/{sessionId}", "not-a-uuid"))
        .andExpect(status().isBadRequest());
  }
}
