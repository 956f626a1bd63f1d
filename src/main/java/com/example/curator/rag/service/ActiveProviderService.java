package com.example.curator.rag.service;

import com.example.curator.rag.config.AiProviderProperties;
import com.example.curator.rag.dao.SettingsDao;
import com.example.curator.rag.model.AiProvider;
import com.example.curator.rag.model.ProviderSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the provider from the settings store on every call (no caching, so a change applies
 * to the next query). Never throws: anything unusable yields the configured default.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActiveProviderService {

    static final String SETTINGS_KEY = "ai_provider";

    private final SettingsDao settingsDao;
    private final ObjectMapper objectMapper;
    private final AiProviderProperties properties;

    public AiProvider getActiveProvider() {
        AiProvider fallback = properties.getDefaultProvider();
        Optional<String> raw;
        try {
            raw = settingsDao.findValue(SETTINGS_KEY);
        } catch (RuntimeException e) {
            log.warn("[provider-selector] settings lookup failed, using {} – {}", fallback.value(), e.getMessage());
            return fallback;
        }

        if (raw.isEmpty()) {
            log.debug("[provider-selector] no {} setting, using {}", SETTINGS_KEY, fallback.value());
            return fallback;
        }

        Optional<AiProvider> provider = parseProvider(raw.get());
        if (provider.isEmpty()) {
            log.warn("[provider-selector] unusable {} setting, using {}", SETTINGS_KEY, fallback.value());
        }
        return provider.orElse(fallback);
    }

    public ProviderSnapshot snapshot() {
        return ProviderSnapshot.of(getActiveProvider());
    }

    private Optional<AiProvider> parseProvider(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            JsonNode provider = node.get("provider");
            if (provider == null || !provider.isTextual()) {
                return Optional.empty();
            }
            return AiProvider.fromValue(provider.asText());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
