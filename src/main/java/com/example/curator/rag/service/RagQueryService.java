package com.example.curator.rag.service;

import com.example.curator.rag.config.RagProperties;
import com.example.curator.rag.model.KbQueryOutcome;
import com.example.curator.rag.model.ProviderSnapshot;
import com.example.curator.rag.model.QueryEmbedding;
import com.example.curator.rag.model.RagQueryOptions;
import com.example.curator.rag.model.RagResult;
import com.example.curator.rag.provider.ModelProviderRegistry;
import com.example.curator.rag.validation.ValidationService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point of retrieval: classify, embed once, fan out to every selected knowledge base and
 * merge the answers into one similarity-ranked result.
 *
 * <p>Validation, classification and embedding failures error the returned Mono; a failing
 * knowledge base only removes its own chunks. Cancelling the subscription cancels every stage
 * still in flight. Nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RagQueryService {

    private static final String NAME = "rag-query";

    private final ValidationService validationService;
    private final ActiveProviderService activeProviderService;
    private final IntentClassifier intentClassifier;
    private final ModelProviderRegistry providers;
    private final KnowledgeBaseQuerier knowledgeBaseQuerier;
    private final ResultAggregator resultAggregator;
    private final RagProperties ragProperties;

    public Mono<RagResult> ragQuery(String query) {
        return ragQuery(query, RagQueryOptions.defaults());
    }

    public Mono<RagResult> ragQuery(String query, RagQueryOptions options) {
        RagQueryOptions opts = options == null ? RagQueryOptions.defaults() : options;
        int maxChunks = resolveMaxChunks(opts.getMaxChunks());

        return Mono.fromCallable(() -> validationService.validate(query))
                .flatMap(text -> Mono.fromCallable(activeProviderService::snapshot)
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(snapshot -> retrieve(text, snapshot, maxChunks)))
                .map(result -> opts.metadataIncluded() ? result : result.withoutMetadata());
    }

    int resolveMaxChunks(Integer requested) {
        if (requested != null && requested > 0) {
            return requested;
        }
        int fallback = ragProperties.getDefaultMaxChunks();
        return fallback > 0 ? fallback : 10;
    }

    private Mono<RagResult> retrieve(String text, ProviderSnapshot snapshot, int maxChunks) {
        long startedAt = System.currentTimeMillis();
        return intentClassifier.classifyIntent(text, snapshot)
                .flatMap(kbs -> embed(text, snapshot)
                        .flatMap(embedding -> fanOut(embedding, kbs, maxChunks, snapshot))
                        .map(outcomes -> resultAggregator.aggregate(outcomes, kbs, maxChunks, snapshot.provider())))
                .doOnNext(result -> log.info("[{}] provider={} kbs={} failed={} chunks={}/{} in {}ms",
                        NAME,
                        snapshot.provider().value(),
                        result.getRelevantKbs(),
                        result.getFailedKbs(),
                        result.getChunks().size(),
                        result.getTotalResults(),
                        System.currentTimeMillis() - startedAt))
                .doOnError(ex -> log.warn("[{}] query failed with provider {} – {}",
                        NAME, snapshot.provider().value(), ex.getMessage()));
    }

    private Mono<QueryEmbedding> embed(String text, ProviderSnapshot snapshot) {
        return Mono.fromCallable(() -> providers.embedderFor(snapshot.provider()).embed(text))
                .subscribeOn(Schedulers.boundedElastic())
                .map(embedding -> {
                    // embeddings of different providers live in different vector spaces
                    if (embedding.provider() != snapshot.provider()) {
                        throw new IllegalStateException("Embedding from " + embedding.provider().value()
                                + " cannot be matched against " + snapshot.provider().value() + " documents");
                    }
                    return embedding;
                });
    }

    private Mono<List<KbQueryOutcome>> fanOut(QueryEmbedding embedding,
                                              List<String> kbs,
                                              int maxChunks,
                                              ProviderSnapshot snapshot) {
        int perKbLimit = resultAggregator.perKbLimit(maxChunks, kbs.size());
        log.debug("[{}] fan-out kbs={} perKbLimit={}", NAME, kbs, perKbLimit);

        // all queries run at once; results come back in kbs order
        return Flux.fromIterable(kbs)
                .flatMapSequential(
                        kb -> knowledgeBaseQuerier.queryKnowledgeBase(embedding, kb, perKbLimit, snapshot),
                        kbs.size())
                .collectList();
    }
}
