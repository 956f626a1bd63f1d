package com.example.curator.rag.dao;

import java.util.Optional;

public interface SettingsDao {

    /**
     * Raw JSON value stored under the given settings key, if any.
     */
    Optional<String> findValue(String key);
}
