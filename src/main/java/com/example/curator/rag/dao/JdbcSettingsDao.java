package com.example.curator.rag.dao;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSettingsDao implements SettingsDao {

    private static final String SQL = """
            select value::text as value
            from public.settings
            where key = ?
            limit 1
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<String> findValue(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        List<String> values = jdbcTemplate.query(SQL, (rs, rowNum) -> rs.getString("value"), key);
        return values.stream().filter(v -> v != null && !v.isBlank()).findFirst();
    }
}
