package com.example.curator.rag.controller;

import com.example.curator.rag.config.RagProperties;
import com.example.curator.rag.model.KnowledgeBase;
import com.example.curator.rag.model.RagQueryOptions;
import com.example.curator.rag.provider.EmbeddingDimensionMismatchException;
import com.example.curator.rag.request.RagQueryRequest;
import com.example.curator.rag.response.KnowledgeBaseResponse;
import com.example.curator.rag.response.RagQueryResponse;
import com.example.curator.rag.service.ActiveProviderService;
import com.example.curator.rag.service.RagQueryService;
import com.example.curator.rag.validation.ValidationException;
import dev.langchain4j.exception.RateLimitException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Slf4j
@RestController
@RequestMapping("/v1/rag")
@Tag(name = "RAG Query API", description = "Knowledge-base routing and similarity retrieval")
@RequiredArgsConstructor
public class RagQueryController {

    private final RagQueryService ragQueryService;
    private final ActiveProviderService activeProviderService;
    private final RagProperties ragProperties;

    @PostMapping("/query")
    @Operation(
            summary = "Retrieve ranked chunks for a question",
            description = "Classifies the question, searches the matching knowledge bases in parallel and returns the best chunks."
    )
    public Mono<ResponseEntity<RagQueryResponse>> query(@RequestBody RagQueryRequest req) {
        RagQueryOptions options = RagQueryOptions.builder()
                .maxChunks(req.getMaxChunks())
                .includeMetadata(req.getIncludeMetadata())
                .build();

        // cancels classification, embedding and every pending KB query when it fires
        return ragQueryService.ragQuery(req.getQuery(), options)
                .timeout(ragProperties.getRequestTimeout())
                .map(result -> ResponseEntity.ok(RagQueryResponse.from(result)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(new RagQueryResponse().setErrors(ex.getReasons()))))
                .onErrorResume(RateLimitException.class, ex ->
                        Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(toRateLimitResponse(ex))))
                .onErrorResume(TimeoutException.class, ex ->
                        Mono.just(ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(RagQueryResponse.error(
                                "Query did not complete within " + ragProperties.getRequestTimeout().toMillis() + "ms"))))
                .onErrorResume(EmbeddingDimensionMismatchException.class, ex -> {
                    log.error("Embedding dimension does not match the vector store", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(RagQueryResponse.error(ex.getMessage())));
                })
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while running rag query", ex);
                    return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                            .body(RagQueryResponse.error("Upstream provider failure: " + ex.getMessage())));
                });
    }

    @GetMapping("/knowledge-bases")
    @Operation(summary = "List the knowledge bases the classifier can route to")
    public List<KnowledgeBaseResponse> knowledgeBases() {
        return Arrays.stream(KnowledgeBase.values()).map(KnowledgeBaseResponse::from).toList();
    }

    @GetMapping("/provider")
    @Operation(summary = "Show the provider the next query will use")
    public Mono<Map<String, String>> provider() {
        return Mono.fromCallable(activeProviderService::getActiveProvider)
                .subscribeOn(Schedulers.boundedElastic())
                .map(provider -> Map.of("provider", provider.value()));
    }

    private RagQueryResponse toRateLimitResponse(RateLimitException ex) {
        String detail = ex == null ? null : ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "AI provider rate limit or quota was exceeded. Please try again later."
                : "AI provider rate limit or quota was exceeded: " + detail;
        return RagQueryResponse.error(message);
    }
}
