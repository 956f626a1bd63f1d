package com.example.curator.rag.dao;

import com.example.curator.rag.model.MatchRequest;
import com.example.curator.rag.model.RetrievedChunk;
import java.util.List;

/**
 * Approximate nearest-neighbour search against the vector backend.
 */
public interface MatchDocumentsDao {

    /**
     * Candidates scoring at least {@code matchThreshold}, restricted to {@code filterDocType} and to
     * embeddings produced by {@code provider}, at most {@code matchCount} of them.
     */
    List<RetrievedChunk> match(MatchRequest request);
}
