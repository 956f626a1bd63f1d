package com.example.curator.rag.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "curator.rag")
public class RagProperties {

    /**
     * Minimum similarity a candidate needs; enforced by the match function, not in Java.
     */
    private double matchThreshold = 0.7;

    private int defaultMaxChunks = 10;

    /**
     * Knowledge base used when the classifier answer cannot be used.
     */
    private String defaultKnowledgeBase = "grants";

    /**
     * Name of the SQL function performing the approximate nearest-neighbour search.
     */
    private String matchFunction = "match_documents";

    private int maxQueryChars = 2000;

    /**
     * Deadline for a whole query (classification, embedding and fan-out).
     */
    private Duration requestTimeout = Duration.ofSeconds(30);
}
