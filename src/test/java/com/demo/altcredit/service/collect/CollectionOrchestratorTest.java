package com.demo.altcredit.service.collect;

import com.demo.altcredit.repository.InMemoryKeyValueStore;
import com.demo.altcredit.service.cache.ResultCache;
import com.demo.altcredit.service.consent.ConsentGate;
import com.demo.altcredit.service.consent.ConsentPrompt;
import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.refresh.RefreshOverwritePolicy;
import com.demo.altcredit.service.risk.AssessmentBasis;
import com.demo.altcredit.service.risk.InsightGenerator;
import com.demo.altcredit.service.risk.RiskAggregator;
import com.demo.altcredit.service.risk.RiskAssessment;
import com.demo.altcredit.service.risk.WeightTable;
import com.demo.altcredit.service.risk.scorers.BehaviorPatternScorer;
import com.demo.altcredit.service.risk.scorers.DeviceSecurityScorer;
import com.demo.altcredit.service.risk.scorers.DigitalFootprintScorer;
import com.demo.altcredit.service.risk.scorers.LocationStabilityScorer;
import com.demo.altcredit.support.StubCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.demo.altcredit.support.TestFixtures.CLOCK;
import static com.demo.altcredit.support.TestFixtures.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("CollectionOrchestrator")
class CollectionOrchestratorTest {

    private ExecutorService executor;
    private ResultCache cache;
    private ConsentGate gate;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        cache = new ResultCache(new InMemoryKeyValueStore(), MAPPER, "test", "s1");
        gate = new ConsentGate(cache, ConsentPrompt.answered(true), CLOCK);
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    private static StubCollector fast(SourceId id, Map<String, Object> payload) {
        return new StubCollector(id, payload);
    }

    private CollectionOrchestrator orchestrator(List<SourceCollector> collectors) {
        return new CollectionOrchestrator(collectors, cache, gate, executor, CLOCK, RefreshOverwritePolicy.OVERWRITE);
    }

    @Test
    @DisplayName("Should keep registration order and cache the assembled profile")
    void assemblesInRegistrationOrder() {
        CollectionOrchestrator o = orchestrator(List.of(
                fast(SourceId.UTILITY, Map.of("connected", true)),
                fast(SourceId.DIGITAL_FOOTPRINT, Map.of("daysSinceFirstInstall", 400))));

        CompositeProfile profile = o.collectAll();

        assertThat(profile.sources().keySet()).containsExactly(SourceId.UTILITY, SourceId.DIGITAL_FOOTPRINT);
        assertThat(profile.trigger()).isEqualTo(CollectionTrigger.EXPLICIT);
        assertThat(profile.cycleId()).isNotBlank();
        assertThat(cache.get()).isEqualTo(profile);
        assertThat(o.isCycleRunning()).isFalse();
    }

    @Test
    @DisplayName("Should still assess with confidence 0.75 when the location source times out")
    void locationTimeoutGivesPartialProfile() {
        // Given
        StubCollector slowLocation = new StubCollector(SourceId.LOCATION, Map.of("latitude", 1.0),
                Duration.ofMillis(200), release);
        CollectionOrchestrator o = orchestrator(List.of(
                fast(SourceId.DIGITAL_FOOTPRINT, Map.of("ownershipStability", "stable", "paymentMethods", List.of("upi"))),
                fast(SourceId.DEVICE_PROFILE, Map.of("securityScore", 70, "stabilityScore", 100)),
                slowLocation,
                fast(SourceId.UTILITY, Map.of("connected", true, "connectionStability", 85))));

        // When
        CompositeProfile profile = o.collectAll();

        // Then
        assertThat(profile.countWithStatus(SourceStatus.SUCCESS)).isEqualTo(3);
        assertThat(profile.sources().get(SourceId.LOCATION).status()).isEqualTo(SourceStatus.TIMED_OUT);
        assertThat(profile.sources().get(SourceId.LOCATION).payload()).isEmpty();

        RiskAggregator aggregator = new RiskAggregator(
                List.of(new DigitalFootprintScorer(), new DeviceSecurityScorer(),
                        new LocationStabilityScorer(), new BehaviorPatternScorer()),
                WeightTable.defaults(), new InsightGenerator(), null, CLOCK);
        RiskAssessment assessment = aggregator.computeRisk(cache.get());

        assertThat(assessment.confidence()).isCloseTo(0.75, within(1e-9));
        assertThat(assessment.componentScores()).doesNotContainKey(SourceId.LOCATION).hasSize(3);
        assertThat(assessment.basis()).isEqualTo(AssessmentBasis.LOCAL_FALLBACK);
        assertThat(assessment.overallScore()).isBetween(0, 100);
    }

    @Test
    @DisplayName("Should let a second caller join the cycle already in flight")
    void concurrentCallersJoin() throws Exception {
        StubCollector held = new StubCollector(SourceId.DEVICE_PROFILE, Map.of("securityScore", 70),
                Duration.ofSeconds(5), release);
        CollectionOrchestrator o = orchestrator(List.of(held));

        CompletableFuture<CompositeProfile> first = o.collectAllAsync(CollectionTrigger.EXPLICIT);
        assertThat(held.awaitStarted()).isTrue();
        CompletableFuture<CompositeProfile> second = o.collectAllAsync(CollectionTrigger.BACKGROUND);

        assertThat(second).isSameAs(first);
        assertThat(o.isCycleRunning()).isTrue();

        release.countDown();
        CompositeProfile profile = first.get(5, TimeUnit.SECONDS);
        assertThat(second.get(5, TimeUnit.SECONDS)).isSameAs(profile);
        assertThat(held.calls()).isEqualTo(1);
        assertThat(o.isCycleRunning()).isFalse();
    }

    @Test
    @DisplayName("Should not cache a cycle that completes after consent was revoked")
    void revokeMidCycleDiscardsResult() throws Exception {
        // Given
        StubCollector held = new StubCollector(SourceId.UTILITY, Map.of("connected", true),
                Duration.ofSeconds(5), release);
        CollectionOrchestrator o = orchestrator(List.of(held));
        CompletableFuture<CompositeProfile> cycle = o.collectAllAsync(CollectionTrigger.EXPLICIT);
        assertThat(held.awaitStarted()).isTrue();

        // When
        gate.revoke();
        release.countDown();
        CompositeProfile profile = cycle.get(5, TimeUnit.SECONDS);

        // Then
        assertThat(profile.sources()).containsKey(SourceId.UTILITY);
        assertThat(gate.hasConsent()).isFalse();
        assertThat(cache.get()).isNull();
    }

    @Test
    @DisplayName("Should start a fresh cycle and drop the old one when consent is revoked and granted again")
    void regrantDoesNotRevivePreRevokeCycle() throws Exception {
        // Given
        CountDownLatch oldRelease = new CountDownLatch(1);
        StubCollector held = new StubCollector(SourceId.UTILITY, Map.of("phase", "before-revoke"),
                Duration.ofSeconds(5), oldRelease);
        CollectionOrchestrator o = orchestrator(List.of(held));
        CompletableFuture<CompositeProfile> stale = o.collectAllAsync();
        assertThat(held.awaitStarted()).isTrue();

        // When
        gate.revoke();
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();
        CompletableFuture<CompositeProfile> fresh = o.collectAllAsync();

        // Then
        assertThat(fresh).isNotSameAs(stale);
        oldRelease.countDown();
        CompositeProfile freshProfile = fresh.get(5, TimeUnit.SECONDS);
        CompositeProfile staleProfile = stale.get(5, TimeUnit.SECONDS);

        assertThat(held.calls()).isEqualTo(2);
        assertThat(cache.get()).isNotNull();
        assertThat(cache.get().cycleId())
                .isEqualTo(freshProfile.cycleId())
                .isNotEqualTo(staleProfile.cycleId());
        assertThat(o.isCycleRunning()).isFalse();
    }

    @Test
    @DisplayName("Should not cache a pre-revoke cycle that completes after a new grant")
    void preRevokeCycleNotCachedAfterRegrant() throws Exception {
        StubCollector held = new StubCollector(SourceId.UTILITY, Map.of("phase", "before-revoke"),
                Duration.ofSeconds(5), release);
        CollectionOrchestrator o = orchestrator(List.of(held));
        CompletableFuture<CompositeProfile> stale = o.collectAllAsync();
        assertThat(held.awaitStarted()).isTrue();

        gate.revoke();
        gate.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null).join();
        release.countDown();
        stale.get(5, TimeUnit.SECONDS);

        assertThat(gate.hasConsent()).isTrue();
        assertThat(cache.get()).isNull();
    }

    @Test
    @DisplayName("Should keep a remote-backed profile when a background cycle runs under PRESERVE_REMOTE")
    void preserveRemoteSkipsBackgroundOverwrite() {
        CompositeProfile explicit = new CompositeProfile("explicit", Map.of(), CLOCK.instant(), 1, CollectionTrigger.EXPLICIT);
        cache.set(explicit);
        cache.setAssessmentIf(() -> true, new RiskAssessment(40, Map.of(), 1.0, List.of(), List.of(),
                CLOCK.instant(), AssessmentBasis.REMOTE, "explicit"));
        CollectionOrchestrator o = new CollectionOrchestrator(List.of(fast(SourceId.UTILITY, Map.of("connected", true))),
                cache, gate, executor, CLOCK, RefreshOverwritePolicy.PRESERVE_REMOTE);

        o.collectAll(CollectionTrigger.BACKGROUND);
        assertThat(cache.get()).isEqualTo(explicit);

        CompositeProfile manual = o.collectAll(CollectionTrigger.EXPLICIT);
        assertThat(cache.get()).isEqualTo(manual);
    }
}
