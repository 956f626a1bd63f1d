package com.example.curator.rag.controller;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.provider.ModelProviderRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Liveness plus the providers that have credentials. Does not touch the database or the models.
 */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final ModelProviderRegistry providers;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "up");
        body.put("providers", providers.configuredProviders().stream().map(AiProvider::value).sorted().toList());
        return Mono.just(ResponseEntity.ok(body));
    }
}
