package com.example.curator.rag.service;

import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.KbQueryOutcome;
import com.example.curator.rag.model.RagResult;
import com.example.curator.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ResultAggregator {

    /**
     * {@code ceil(maxChunks / kbCount)}.
     */
    public int perKbLimit(int maxChunks, int kbCount) {
        if (maxChunks <= 0) {
            throw new IllegalArgumentException("maxChunks must be positive");
        }
        if (kbCount <= 0) {
            throw new IllegalArgumentException("kbCount must be positive");
        }
        return (maxChunks + kbCount - 1) / kbCount;
    }

    /**
     * Flattens the outcomes in fan-out order, sorts by similarity descending and keeps the first
     * {@code maxChunks}. The sort is stable, so equal scores keep their fan-out order.
     */
    public RagResult aggregate(List<KbQueryOutcome> outcomes,
                               List<String> relevantKbs,
                               int maxChunks,
                               AiProvider provider) {
        List<RetrievedChunk> all = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (KbQueryOutcome outcome : outcomes) {
            if (outcome.isFailure()) {
                failed.add(outcome.kbId());
            }
            all.addAll(outcome.chunks());
        }

        all.sort(Comparator.comparingDouble(RetrievedChunk::getSimilarity).reversed());
        List<RetrievedChunk> ranked = all.size() > maxChunks
                ? List.copyOf(all.subList(0, maxChunks))
                : List.copyOf(all);

        return RagResult.builder()
                .chunks(ranked)
                .relevantKbs(List.copyOf(relevantKbs))
                .totalResults(all.size())
                .failedKbs(List.copyOf(failed))
                .provider(provider)
                .build();
    }
}
