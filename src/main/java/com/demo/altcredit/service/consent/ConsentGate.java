package com.demo.altcredit.service.consent;

import com.demo.altcredit.service.cache.ResultCache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sole writer of the {@link ConsentRecord}. Everything else reads {@link #hasConsent()}.
 */
@Slf4j
public class ConsentGate implements ConsentState {

    private final ResultCache cache;
    private final ConsentPrompt prompt;
    private final Clock clock;
    private final List<ConsentListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong epoch = new AtomicLong();

    private volatile ConsentRecord record = ConsentRecord.undecided();

    public ConsentGate(ResultCache cache, ConsentPrompt prompt, Clock clock) {
        this.cache = cache;
        this.prompt = prompt;
        this.clock = clock;
    }

    public void addListener(ConsentListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConsentListener listener) {
        listeners.remove(listener);
    }

    /** Adopts the persisted record; a still-granted record re-arms listeners. */
    public synchronized void init() {
        ConsentRecord stored = cache.getConsent();
        if (stored == null) return;
        record = stored;
        if (stored.granted()) {
            log.info("Restored granted consent for {}", stored.scope());
            listeners.forEach(l -> l.onConsentGranted(stored));
        }
    }

    public CompletableFuture<Boolean> requestConsent(ConsentPurpose purpose, String explanation) {
        return requestConsent(purpose, explanation, false, prompt);
    }

    public CompletableFuture<Boolean> requestConsent(ConsentPurpose purpose, String explanation, boolean force) {
        return requestConsent(purpose, explanation, force, prompt);
    }

    /**
     * Asks {@code via} unless consent is already granted and {@code force} is false, then
     * persists the decision. A prompt that fails counts as "no decision": the record stays
     * as it was and the future completes with the current state.
     */
    public CompletableFuture<Boolean> requestConsent(ConsentPurpose purpose, String explanation,
                                                     boolean force, ConsentPrompt via) {
        if (purpose == null) throw new IllegalArgumentException("purpose is required");
        if (!force && record.granted()) {
            return CompletableFuture.completedFuture(true);
        }
        String text = (explanation == null || explanation.isBlank()) ? purpose.defaultExplanation() : explanation;

        CompletableFuture<Boolean> asked;
        try {
            asked = via.ask(purpose, text);
        } catch (RuntimeException ex) {
            asked = CompletableFuture.failedFuture(ex);
        }
        return asked.handle((decision, err) -> {
            if (err != null) {
                log.warn("Consent prompt for {} failed: {}", purpose, err.toString());
                return record.granted();
            }
            return applyDecision(purpose, Boolean.TRUE.equals(decision));
        });
    }

    private synchronized boolean applyDecision(ConsentPurpose purpose, boolean granted) {
        if (granted) {
            ConsentRecord next = ConsentRecord.grantedFor(purpose, clock.instant());
            record = next;
            cache.setConsent(next);
            log.info("Consent granted for {}", purpose);
            listeners.forEach(l -> l.onConsentGranted(next));
            return true;
        }
        if (record.granted()) {
            log.info("Consent declined on re-prompt for {}, revoking", purpose);
            revoke();
            return false;
        }
        ConsentRecord next = record.deniedFor(purpose);
        record = next;
        cache.setConsent(next);
        log.info("Consent denied for {}", purpose);
        return false;
    }

    /**
     * Withdraws consent, drops cached results and notifies listeners. Safe to repeat.
     * The record flips before the cache is cleared so an in-flight cycle can no longer publish.
     */
    public synchronized void revoke() {
        ConsentRecord next = record.revokedAt(clock.instant());
        record = next;
        epoch.incrementAndGet();
        cache.setConsent(next);
        cache.clear();
        listeners.forEach(l -> l.onConsentRevoked(next));
        log.info("Consent revoked");
    }

    @Override
    public boolean hasConsent() {
        return record.granted();
    }

    @Override
    public long epoch() {
        return epoch.get();
    }

    public ConsentRecord current() {
        return record;
    }
}
