package com.example.curator.rag.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.curator.rag.config.RagProperties;
import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.RagQueryOptions;
import com.example.curator.rag.model.RagResult;
import com.example.curator.rag.model.RetrievedChunk;
import com.example.curator.rag.provider.EmbeddingDimensionMismatchException;
import com.example.curator.rag.request.RagQueryRequest;
import com.example.curator.rag.response.KnowledgeBaseResponse;
import com.example.curator.rag.response.RagQueryResponse;
import com.example.curator.rag.service.ActiveProviderService;
import com.example.curator.rag.service.RagQueryService;
import com.example.curator.rag.validation.ValidationException;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

class RagQueryControllerTest {

  private final RagQueryService ragQueryService = mock(RagQueryService.class);
  private final ActiveProviderService activeProviderService = mock(ActiveProviderService.class);
  private final RagProperties ragProperties = new RagProperties();
  private final RagQueryController controller =
      new RagQueryController(ragQueryService, activeProviderService, ragProperties);

  @Test
  void queryReturnsRankedChunks() {
    RagResult result = RagResult.builder()
        .chunks(List.of(RetrievedChunk.builder().id("1").docType("grants").content("HRSA grant").similarity(0.9).build()))
        .relevantKbs(List.of("grants", "astrology"))
        .totalResults(1)
        .failedKbs(List.of("astrology"))
        .provider(AiProvider.GEMINI)
        .build();
    when(ragQueryService.ragQuery(eq("HRSA funding"), any())).thenReturn(Mono.just(result));

    ResponseEntity<RagQueryResponse> response = controller.query(
        new RagQueryRequest().setQuery("HRSA funding").setMaxChunks(5).setIncludeMetadata(false)).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getChunks()).extracting(RetrievedChunk::getId).containsExactly("1");
    assertThat(response.getBody().getRelevantKbs()).containsExactly("grants", "astrology");
    assertThat(response.getBody().getFailedKbs()).containsExactly("astrology");
    assertThat(response.getBody().getProvider()).isEqualTo("gemini");
    assertThat(response.getBody().getErrors()).isNull();

    ArgumentCaptor<RagQueryOptions> options = ArgumentCaptor.forClass(RagQueryOptions.class);
    verify(ragQueryService).ragQuery(eq("HRSA funding"), options.capture());
    assertThat(options.getValue().getMaxChunks()).isEqualTo(5);
    assertThat(options.getValue().getIncludeMetadata()).isFalse();
  }

  @Test
  void validationFailureIsBadRequest() {
    when(ragQueryService.ragQuery(eq(" "), any()))
        .thenReturn(Mono.error(new ValidationException("Query must not be blank.")));

    ResponseEntity<RagQueryResponse> response = controller.query(new RagQueryRequest().setQuery(" ")).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().getErrors()).containsExactly("Query must not be blank.");
  }

  @Test
  void rateLimitIsTooManyRequests() {
    when(ragQueryService.ragQuery(eq("q"), any()))
        .thenReturn(Mono.error(new RateLimitException("quota exceeded")));

    ResponseEntity<RagQueryResponse> response = controller.query(new RagQueryRequest().setQuery("q")).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(429);
    assertThat(response.getBody().getErrors())
        .containsExactly("AI provider rate limit or quota was exceeded: quota exceeded");
  }

  @Test
  void dimensionMismatchIsServerError() {
    when(ragQueryService.ragQuery(eq("q"), any()))
        .thenReturn(Mono.error(new EmbeddingDimensionMismatchException(AiProvider.OPENAI, 1536, 3072)));

    ResponseEntity<RagQueryResponse> response = controller.query(new RagQueryRequest().setQuery("q")).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(500);
  }

  @Test
  void providerFailureIsBadGateway() {
    when(ragQueryService.ragQuery(eq("q"), any()))
        .thenReturn(Mono.error(new IllegalStateException("connection reset")));

    ResponseEntity<RagQueryResponse> response = controller.query(new RagQueryRequest().setQuery("q")).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(502);
    assertThat(response.getBody().getErrors()).containsExactly("Upstream provider failure: connection reset");
  }

  @Test
  void slowQueryTimesOutAndIsCancelled() {
    ragProperties.setRequestTimeout(Duration.ofMillis(50));
    AtomicBoolean cancelled = new AtomicBoolean();
    when(ragQueryService.ragQuery(eq("q"), any()))
        .thenReturn(Mono.<RagResult>never().doOnCancel(() -> cancelled.set(true)));

    ResponseEntity<RagQueryResponse> response =
        controller.query(new RagQueryRequest().setQuery("q")).block(Duration.ofSeconds(5));

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(504);
    assertThat(cancelled).isTrue();
  }

  @Test
  void listsAllKnowledgeBases() {
    assertThat(controller.knowledgeBases()).hasSize(7)
        .extracting(KnowledgeBaseResponse::id)
        .contains("grants", "it_security", "compliance", "fhir", "billing", "vbc", "operations");
  }

  @Test
  void reportsActiveProvider() {
    when(activeProviderService.getActiveProvider()).thenReturn(AiProvider.OPENAI);

    Map<String, String> body = controller.provider().block();

    assertThat(body).containsEntry("provider", "openai");
  }
}
