package com.example.curator.rag.dao;

import com.example.curator.rag.config.RagProperties;
import com.example.curator.rag.model.MatchRequest;
import com.example.curator.rag.model.RetrievedChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Calls the Supabase match function directly over JDBC:
 * {@code match_documents(query_embedding, match_threshold, match_count, filter_doc_type, provider)}.
 */
@Slf4j
@Repository
public class JdbcMatchDocumentsDao implements MatchDocumentsDao {

    private static final Pattern SQL_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String sql;

    public JdbcMatchDocumentsDao(NamedParameterJdbcTemplate jdbcTemplate,
                                 ObjectMapper objectMapper,
                                 RagProperties ragProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        boundQueryTimeout(jdbcTemplate.getJdbcTemplate(), ragProperties.getRequestTimeout());
        String function = ragProperties.getMatchFunction();
        if (function == null || !SQL_IDENTIFIER.matcher(function).matches()) {
            throw new IllegalArgumentException("Invalid match function name: " + function);
        }
        this.sql = "select * from " + function
                + "(:query_embedding, :match_threshold, :match_count, :filter_doc_type, :provider)";
    }

    @Override
    public List<RetrievedChunk> match(MatchRequest request) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("query_embedding", new PGvector(request.queryEmbedding()))
                .addValue("match_threshold", request.matchThreshold())
                .addValue("match_count", request.matchCount())
                .addValue("filter_doc_type", request.filterDocType())
                .addValue("provider", request.provider());

        return jdbcTemplate.query(sql, params, (rs, rowNum) -> toChunk(rs, request.filterDocType()));
    }

    /**
     * A cancelled query does not stop a statement blocked on the socket, so the statement itself
     * must give up no later than the request does and hand its connection back to the pool.
     */
    static void boundQueryTimeout(JdbcTemplate template, Duration requestTimeout) {
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            return;
        }
        int deadlineSeconds = (int) Math.max(1, (requestTimeout.toMillis() + 999) / 1000);
        int current = template.getQueryTimeout();
        if (current <= 0 || current > deadlineSeconds) {
            log.info("[kb-querier] statement timeout set to {}s (was {}s)", deadlineSeconds, current);
            template.setQueryTimeout(deadlineSeconds);
        }
    }

    private RetrievedChunk toChunk(ResultSet rs, String filterDocType) throws SQLException {
        Set<String> columns = columnLabels(rs.getMetaData());

        Object id = columns.contains("id") ? rs.getObject("id") : null;
        String docType = columns.contains("doc_type") ? rs.getString("doc_type") : filterDocType;
        String metadata = columns.contains("metadata") ? rs.getString("metadata") : null;

        return RetrievedChunk.builder()
                .id(id == null ? null : id.toString())
                .docType(docType)
                .content(rs.getString("content"))
                .metadata(parseMetadata(metadata))
                .similarity(rs.getDouble("similarity"))
                .build();
    }

    private Map<String, Object> parseMetadata(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(raw, METADATA_TYPE);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.debug("[kb-querier] metadata is not a JSON object, keeping raw text");
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put("raw", raw);
            return fallback;
        }
    }

    private static Set<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return labels;
    }
}
