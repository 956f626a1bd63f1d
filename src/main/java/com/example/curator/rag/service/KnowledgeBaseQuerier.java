package com.example.curator.rag.service;

import com.example.curator.rag.config.RagProperties;
import com.example.curator.rag.dao.MatchDocumentsDao;
import com.example.curator.rag.model.KbQueryOutcome;
import com.example.curator.rag.model.MatchRequest;
import com.example.curator.rag.model.ProviderSnapshot;
import com.example.curator.rag.model.QueryEmbedding;
import com.example.curator.rag.model.RetrievedChunk;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * One similarity search per knowledge base. The returned Mono never errors: a backend failure is
 * logged and turned into an empty outcome so the other knowledge bases of the same query still return.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeBaseQuerier {

    private static final String NAME = "kb-querier";

    private final MatchDocumentsDao matchDocumentsDao;
    private final RagProperties ragProperties;

    public Mono<KbQueryOutcome> queryKnowledgeBase(QueryEmbedding embedding,
                                                   String kbId,
                                                   int limit,
                                                   ProviderSnapshot snapshot) {
        MatchRequest request = new MatchRequest(
                embedding.vector(),
                ragProperties.getMatchThreshold(),
                limit,
                kbId,
                snapshot.provider().value());

        return Mono.fromCallable(() -> Objects.requireNonNullElse(
                        matchDocumentsDao.match(request), List.<RetrievedChunk>of()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(chunks -> {
                    log.debug("[{}] kb={} limit={} matches={}", NAME, kbId, limit, chunks.size());
                    return KbQueryOutcome.success(kbId, chunks);
                })
                .onErrorResume(ex -> {
                    log.warn("[{}] Error querying {} KB – {}", NAME, kbId, ex.getMessage());
                    return Mono.just(KbQueryOutcome.failure(kbId, ex));
                });
    }
}
