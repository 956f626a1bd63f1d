package com.example.curator.rag.model;

import java.util.List;

/**
 * Result of querying a single knowledge base: either the matched chunks or the failure that
 * replaced them with an empty list.
 */
public record KbQueryOutcome(String kbId, List<RetrievedChunk> chunks, Throwable error) {

    public KbQueryOutcome {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static KbQueryOutcome success(String kbId, List<RetrievedChunk> chunks) {
        return new KbQueryOutcome(kbId, chunks, null);
    }

    public static KbQueryOutcome failure(String kbId, Throwable error) {
        return new KbQueryOutcome(kbId, List.of(), error);
    }

    public boolean isFailure() {
        return error != null;
    }
}
