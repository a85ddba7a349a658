package com.demo.altcredit.repository;

import java.util.Optional;

/** Persistent string store; values are JSON documents written by the result cache. */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);
}
