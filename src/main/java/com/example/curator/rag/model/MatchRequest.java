package com.example.curator.rag.model;

/**
 * Arguments of one match_documents call.
 */
public record MatchRequest(
        float[] queryEmbedding,
        double matchThreshold,
        int matchCount,
        String filterDocType,
        String provider
) {
}
