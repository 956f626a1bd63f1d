package com.example.curator.rag.service;

import com.example.curator.rag.config.RagProperties;
import com.example.curator.rag.model.KnowledgeBase;
import com.example.curator.rag.model.ProviderSnapshot;
import com.example.curator.rag.provider.ModelProviderRegistry;
import com.example.curator.rag.provider.TextCompleter;
import com.example.curator.rag.util.CodeFenceUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Maps a question to the knowledge bases worth searching, using a temperature-0 completion that
 * must answer with a JSON array of ids.
 *
 * <p>Ids outside {@link KnowledgeBase} are passed through unchanged; they simply match no
 * documents downstream.
 */
@Slf4j
@Service
public class IntentClassifier {

    private static final String NAME = "intent-classifier";

    static final String SYSTEM_INSTRUCTION = buildSystemInstruction();

    private final ModelProviderRegistry providers;
    private final ObjectMapper objectMapper;
    private final String defaultKnowledgeBase;

    public IntentClassifier(ModelProviderRegistry providers, ObjectMapper objectMapper, RagProperties ragProperties) {
        this.providers = providers;
        this.objectMapper = objectMapper;
        this.defaultKnowledgeBase = ragProperties.getDefaultKnowledgeBase();
    }

    /**
     * Non-empty, ordered, duplicate-free list of knowledge base ids. Provider failures error the Mono;
     * unusable answers fall back to the default knowledge base.
     */
    public Mono<List<String>> classifyIntent(String query, ProviderSnapshot snapshot) {
        return Mono.fromCallable(() -> {
                    TextCompleter completer = providers.completerFor(snapshot.provider());
                    return completer.complete(SYSTEM_INSTRUCTION, query);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::parseKnowledgeBases)
                .doOnNext(kbs -> log.debug("[{}] provider={} kbs={}", NAME, snapshot.provider().value(), kbs));
    }

    List<String> parseKnowledgeBases(String content) {
        String json = CodeFenceUtils.stripFences(content == null || content.isBlank() ? "[]" : content);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[{}] could not parse classification '{}', using {}", NAME, abbreviate(json), defaultKnowledgeBase);
            return List.of(defaultKnowledgeBase);
        }

        if (node == null || !node.isArray()) {
            log.warn("[{}] classification is not a JSON array, using {}", NAME, defaultKnowledgeBase);
            return List.of(defaultKnowledgeBase);
        }

        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode element : node) {
            if (element.isTextual() && !element.asText().isBlank()) {
                ids.add(element.asText().trim());
            }
        }
        if (ids.isEmpty()) {
            return List.of(defaultKnowledgeBase);
        }

        for (String id : ids) {
            if (KnowledgeBase.fromId(id).isEmpty()) {
                log.debug("[{}] '{}' is not a known knowledge base; it will match nothing", NAME, id);
            }
        }
        return new ArrayList<>(ids);
    }

    private static String buildSystemInstruction() {
        StringBuilder sb = new StringBuilder()
                .append("You are a query classifier for a rural healthcare knowledge base system.\n\n")
                .append("Available knowledge bases:\n");
        for (KnowledgeBase kb : KnowledgeBase.values()) {
            sb.append("- ").append(kb.id()).append(": ").append(kb.description()).append('\n');
        }
        return sb.append('\n')
                .append("Classify the query into one or more relevant knowledge bases.\n")
                .append("Return ONLY a JSON array of KB names, e.g., [\"fhir\", \"it_security\"]")
                .toString();
    }

    private static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
