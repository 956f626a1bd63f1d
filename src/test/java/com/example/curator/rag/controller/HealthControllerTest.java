package com.example.curator.rag.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.provider.ModelProviderRegistry;
import com.example.curator.rag.provider.TextCompleter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class HealthControllerTest {

  @Test
  void reportsUpWithConfiguredProviders() {
    ModelProviderRegistry registry = new ModelProviderRegistry(
        Map.of(AiProvider.OPENAI, mock(TextCompleter.class), AiProvider.GEMINI, mock(TextCompleter.class)),
        Map.of());

    ResponseEntity<Map<String, Object>> response = new HealthController(registry).health().block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    assertThat(response.getBody())
        .containsEntry("status", "up")
        .containsEntry("providers", List.of("gemini", "openai"));
  }
}
