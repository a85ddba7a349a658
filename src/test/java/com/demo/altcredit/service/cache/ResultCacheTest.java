package com.demo.altcredit.service.cache;

import com.demo.altcredit.repository.InMemoryKeyValueStore;
import com.demo.altcredit.repository.KeyValueStore;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.SourceResult;
import com.demo.altcredit.service.collect.collectors.DeviceProfileCollector;
import com.demo.altcredit.service.collect.collectors.DigitalFootprintCollector;
import com.demo.altcredit.service.collect.collectors.LocationCollector;
import com.demo.altcredit.service.collect.collectors.UtilityCollector;
import com.demo.altcredit.service.collect.device.ReportedSignalProviders;
import com.demo.altcredit.service.collect.CollectionTrigger;
import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.consent.ConsentState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.demo.altcredit.support.TestFixtures.CLOCK;
import static com.demo.altcredit.support.TestFixtures.MAPPER;
import static com.demo.altcredit.support.TestFixtures.NOW;
import static com.demo.altcredit.support.TestFixtures.fullSignals;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("ResultCache")
class ResultCacheTest {

    /** Runs the real collectors so the payloads carry every value type they produce. */
    private static CompositeProfile collectedProfile() {
        ReportedSignalProviders signals = new ReportedSignalProviders();
        signals.report(fullSignals());
        ConsentState consent = () -> true;
        Duration t = Duration.ofSeconds(1);
        Map<SourceId, SourceResult> results = new LinkedHashMap<>();
        results.put(SourceId.DIGITAL_FOOTPRINT,
                new DigitalFootprintCollector(consent, MAPPER, CLOCK, t, signals, signals).collect());
        results.put(SourceId.DEVICE_PROFILE, new DeviceProfileCollector(consent, MAPPER, CLOCK, t, signals).collect());
        results.put(SourceId.LOCATION,
                new LocationCollector(consent, MAPPER, CLOCK, t, signals, ConsentPurpose.FRAUD_PREVENTION).collect());
        results.put(SourceId.UTILITY, new UtilityCollector(consent, MAPPER, CLOCK, t, signals, signals).collect());
        return new CompositeProfile("cycle-1", results, NOW, 42, CollectionTrigger.EXPLICIT);
    }

    @Test
    @DisplayName("Should restore a profile equal to the one stored")
    void profileRoundTrip() {
        // Given
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        ResultCache cache = new ResultCache(store, MAPPER, "altcredit", "abc");
        CompositeProfile profile = collectedProfile();

        // When
        cache.set(profile);
        ResultCache reloaded = new ResultCache(store, MAPPER, "altcredit", "abc");
        reloaded.load();

        // Then
        assertThat(store.get("altcredit:abc:profile")).isPresent();
        assertThat(reloaded.get()).isEqualTo(profile);
        assertThat(reloaded.get().sources().keySet()).containsExactly(
                SourceId.DIGITAL_FOOTPRINT, SourceId.DEVICE_PROFILE, SourceId.LOCATION, SourceId.UTILITY);
    }

    @Test
    @DisplayName("Should keep the in-memory profile when the store rejects the write")
    void writeFailureIsSoft() {
        KeyValueStore failing = mock(KeyValueStore.class);
        doThrow(new DataAccessResourceFailureException("db down")).when(failing).set(anyString(), anyString());
        ResultCache cache = new ResultCache(failing, MAPPER, "altcredit", "abc");
        CompositeProfile profile = collectedProfile();

        cache.set(profile);

        assertThat(cache.get()).isEqualTo(profile);
        assertThat(cache.isPersistencePending()).isTrue();
    }

    @Test
    void guardedWriteIsSkipped() {
        ResultCache cache = new ResultCache(new InMemoryKeyValueStore(), MAPPER, "altcredit", "abc");

        boolean written = cache.setIf(() -> false, collectedProfile());

        assertThat(written).isFalse();
        assertThat(cache.get()).isNull();
    }

    @Test
    void unreadableEntryIsDiscarded() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.set("altcredit:abc:profile", "{not json");
        ResultCache cache = new ResultCache(store, MAPPER, "altcredit", "abc");

        cache.load();

        assertThat(cache.get()).isNull();
    }
}
