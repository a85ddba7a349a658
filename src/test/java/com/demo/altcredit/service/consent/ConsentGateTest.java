package com.demo.altcredit.service.consent;

import com.demo.altcredit.repository.InMemoryKeyValueStore;
import com.demo.altcredit.service.cache.ResultCache;
import com.demo.altcredit.service.collect.CollectionTrigger;
import com.demo.altcredit.service.collect.CompositeProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static com.demo.altcredit.support.TestFixtures.CLOCK;
import static com.demo.altcredit.support.TestFixtures.MAPPER;
import static com.demo.altcredit.support.TestFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("ConsentGate")
class ConsentGateTest {

    private InMemoryKeyValueStore store;
    private ResultCache cache;
    private AtomicInteger prompts;
    private ConsentGate gate;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        cache = new ResultCache(store, MAPPER, "test", "s1");
        prompts = new AtomicInteger();
        gate = new ConsentGate(cache, countingPrompt(true), CLOCK);
    }

    private ConsentPrompt countingPrompt(boolean answer) {
        return (purpose, explanation) -> {
            prompts.incrementAndGet();
            return CompletableFuture.completedFuture(answer);
        };
    }

    @Test
    @DisplayName("Should persist a granted decision and notify listeners")
    void grantPersistsAndNotifies() {
        // Given
        ConsentListener listener = mock(ConsentListener.class);
        gate.addListener(listener);

        // When
        boolean granted = gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, "Why we ask").join();

        // Then
        assertThat(granted).isTrue();
        assertThat(gate.hasConsent()).isTrue();
        assertThat(gate.current().scope()).isEqualTo(ConsentPurpose.CREDIT_ASSESSMENT);
        assertThat(gate.current().grantedAt()).isEqualTo(NOW);
        verify(listener).onConsentGranted(any());

        ResultCache reloaded = new ResultCache(store, MAPPER, "test", "s1");
        reloaded.load();
        assertThat(reloaded.getConsent()).isEqualTo(gate.current());
    }

    @Test
    @DisplayName("Should not prompt again while consent is granted unless forced")
    void shortCircuitsWhenAlreadyGranted() {
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();

        boolean again = gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();
        assertThat(again).isTrue();
        assertThat(prompts.get()).isEqualTo(1);

        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null, true).join();
        assertThat(prompts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should leave no consent and nothing cached when the prompt is denied")
    void deniedPromptLeavesNoConsent() {
        // Given
        ConsentListener listener = mock(ConsentListener.class);
        ConsentGate denying = new ConsentGate(cache, countingPrompt(false), CLOCK);
        denying.addListener(listener);

        // When
        boolean result = denying.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, "Why we ask").join();

        // Then
        assertThat(result).isFalse();
        assertThat(denying.hasConsent()).isFalse();
        assertThat(cache.get()).isNull();
        assertThat(cache.getConsent().granted()).isFalse();
        verify(listener, never()).onConsentGranted(any());
    }

    @Test
    @DisplayName("Should treat a failing prompt as no decision")
    void failingPromptKeepsState() {
        ConsentGate failing = new ConsentGate(cache,
                (purpose, explanation) -> CompletableFuture.failedFuture(new IllegalStateException("dialog closed")),
                CLOCK);

        boolean result = failing.requestConsent(ConsentPurpose.FRAUD_PREVENTION, null).join();

        assertThat(result).isFalse();
        assertThat(failing.current()).isEqualTo(ConsentRecord.undecided());
        assertThat(cache.getConsent()).isNull();
    }

    @Test
    @DisplayName("Should clear cached results and stay revoked when revoke is repeated")
    void revokeIsIdempotent() {
        // Given
        ConsentListener listener = mock(ConsentListener.class);
        gate.addListener(listener);
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();
        cache.set(new CompositeProfile("c1", Map.of(), NOW, 3, CollectionTrigger.EXPLICIT));

        // When
        gate.revoke();
        ConsentRecord afterFirst = gate.current();
        gate.revoke();

        // Then
        assertThat(gate.hasConsent()).isFalse();
        assertThat(gate.current()).isEqualTo(afterFirst);
        assertThat(afterFirst.revokedAt()).isEqualTo(NOW);
        assertThat(cache.get()).isNull();
        assertThat(store.get("test:s1:profile")).isEmpty();
        verify(listener, times(2)).onConsentRevoked(any());
    }

    @Test
    @DisplayName("Should not honour a grant observed before a revocation, even after consent is granted again")
    void regrantStartsNewEpoch() {
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();
        long before = gate.epoch();
        assertThat(gate.heldSince(before)).isTrue();

        gate.revoke();
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();

        assertThat(gate.hasConsent()).isTrue();
        assertThat(gate.heldSince(before)).isFalse();
        assertThat(gate.heldSince(gate.epoch())).isTrue();
    }

    @Test
    @DisplayName("Should revoke when a forced re-prompt is declined")
    void declinedReprompt() {
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();

        boolean result = gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null, true,
                ConsentPrompt.answered(false)).join();

        assertThat(result).isFalse();
        assertThat(gate.hasConsent()).isFalse();
        assertThat(gate.current().revokedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should restore a persisted grant and re-arm listeners on init")
    void initRestoresGrant() {
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();

        ResultCache restoredCache = new ResultCache(store, MAPPER, "test", "s1");
        restoredCache.load();
        ConsentGate restored = new ConsentGate(restoredCache, ConsentPrompt.answered(false), CLOCK);
        ConsentListener listener = mock(ConsentListener.class);
        restored.addListener(listener);

        restored.init();

        assertThat(restored.hasConsent()).isTrue();
        verify(listener).onConsentGranted(any());
    }

    @Test
    void rejectsMissingPurpose() {
        assertThatThrownBy(() -> gate.requestConsent(null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
