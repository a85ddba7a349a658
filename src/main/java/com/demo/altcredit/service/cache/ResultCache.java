package com.demo.altcredit.service.cache;

import com.demo.altcredit.repository.KeyValueStore;
import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.consent.ConsentRecord;
import com.demo.altcredit.service.risk.RiskAssessment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Latest profile, consent record and assessment of one session, mirrored to a
 * {@link KeyValueStore}. Memory is authoritative: a failed store write is logged, the
 * in-memory value stays, and the next profile write persists again.
 */
@Slf4j
public class ResultCache {

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final String profileKey;
    private final String consentKey;
    private final String assessmentKey;

    private final Object lock = new Object();
    private volatile CompositeProfile profile;
    private volatile ConsentRecord consent;
    private volatile RiskAssessment assessment;
    private volatile boolean persistencePending;

    public ResultCache(KeyValueStore store, ObjectMapper objectMapper, String keyPrefix, String sessionId) {
        this.store = store;
        this.objectMapper = objectMapper;
        String base = keyPrefix + ":" + sessionId + ":";
        this.profileKey = base + "profile";
        this.consentKey = base + "consent";
        this.assessmentKey = base + "assessment";
    }

    /** Restores whatever the store holds for this session. */
    public void load() {
        synchronized (lock) {
            profile = read(profileKey, CompositeProfile.class).orElse(null);
            consent = read(consentKey, ConsentRecord.class).orElse(null);
            assessment = read(assessmentKey, RiskAssessment.class).orElse(null);
        }
    }

    public CompositeProfile get() {
        return profile;
    }

    public void set(CompositeProfile next) {
        setIf(() -> true, next);
    }

    /**
     * Replaces the profile only if {@code guard} holds at write time; the check and the
     * replace happen under the same lock as {@link #clear()}.
     *
     * @return whether the profile was replaced
     */
    public boolean setIf(BooleanSupplier guard, CompositeProfile next) {
        synchronized (lock) {
            if (!guard.getAsBoolean()) return false;
            profile = next;
            persistencePending = !write(profileKey, next);
            return true;
        }
    }

    public void clear() {
        synchronized (lock) {
            profile = null;
            assessment = null;
            persistencePending = false;
            remove(profileKey);
            remove(assessmentKey);
        }
    }

    public ConsentRecord getConsent() {
        return consent;
    }

    public void setConsent(ConsentRecord record) {
        synchronized (lock) {
            consent = record;
            write(consentKey, record);
        }
    }

    public RiskAssessment getAssessment() {
        return assessment;
    }

    /** Stores {@code next} unless {@code guard} fails at write time; same locking as {@link #setIf}. */
    public boolean setAssessmentIf(BooleanSupplier guard, RiskAssessment next) {
        synchronized (lock) {
            if (!guard.getAsBoolean()) return false;
            assessment = next;
            write(assessmentKey, next);
            return true;
        }
    }

    /** True when the held profile has not reached the store yet. */
    public boolean isPersistencePending() {
        return persistencePending;
    }

    private boolean write(String key, Object value) {
        try {
            store.set(key, objectMapper.writeValueAsString(value));
            return true;
        } catch (JsonProcessingException ex) {
            log.warn("Could not serialize {}: {}", key, ex.getOriginalMessage());
            return false;
        } catch (RuntimeException ex) {
            log.warn("Cache write failed for {}, keeping in-memory copy: {}", key, ex.toString());
            return false;
        }
    }

    private void remove(String key) {
        try {
            store.remove(key);
        } catch (RuntimeException ex) {
            log.warn("Cache remove failed for {}: {}", key, ex.toString());
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) return Optional.empty();
            return Optional.of(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException ex) {
            log.warn("Discarding unreadable cache entry {}: {}", key, ex.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Cache read failed for {}: {}", key, ex.toString());
            return Optional.empty();
        }
    }
}
