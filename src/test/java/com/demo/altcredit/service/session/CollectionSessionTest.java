package com.demo.altcredit.service.session;

import com.demo.altcredit.config.CollectionProperties;
import com.demo.altcredit.repository.InMemoryKeyValueStore;
import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.SourceStatus;
import com.demo.altcredit.service.collect.collectors.LocationPermissionState;
import com.demo.altcredit.service.consent.ConsentPrompt;
import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.refresh.RefresherState;
import com.demo.altcredit.service.risk.AssessmentBasis;
import com.demo.altcredit.service.risk.RiskAssessment;
import com.demo.altcredit.service.risk.ScoringBackendClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.demo.altcredit.support.TestFixtures.CLOCK;
import static com.demo.altcredit.support.TestFixtures.MAPPER;
import static com.demo.altcredit.support.TestFixtures.fullSignals;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("CollectionSession")
class CollectionSessionTest {

    private ExecutorService executor;
    private InMemoryKeyValueStore store;
    private CollectionSessionFactory factory;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        store = new InMemoryKeyValueStore();
        factory = new CollectionSessionFactory(new CollectionProperties(), MAPPER, store,
                new ScoringBackendClient(new RestTemplate(), ""), mock(TaskScheduler.class), executor, CLOCK);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CollectionSession open(String id) {
        return factory.create(id, ConsentPrompt.answered(false)).init();
    }

    @Test
    @DisplayName("Should cache nothing and leave the refresher stopped when consent is declined")
    void declinedConsent() {
        CollectionSession session = open("a");
        session.reportSignals(fullSignals());

        boolean granted = session.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null, false,
                ConsentPrompt.answered(false)).join();
        CompositeProfile attempted = session.collectAll();

        assertThat(granted).isFalse();
        assertThat(session.hasConsent()).isFalse();
        assertThat(attempted.sources().values()).allMatch(r -> r.status() == SourceStatus.PERMISSION_DENIED);
        assertThat(session.profile()).isNull();
        assertThat(session.refresherState()).isEqualTo(RefresherState.STOPPED);
    }

    @Test
    @DisplayName("Should collect, assess and then forget everything on revoke")
    void grantCollectAssessRevoke() {
        // Given
        CollectionSession session = open("b");
        session.reportSignals(fullSignals());
        session.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null, false, ConsentPrompt.answered(true)).join();

        // When
        CompositeProfile profile = session.collectAll();
        RiskAssessment assessment = session.computeRisk();

        // Then
        assertThat(session.refresherState()).isEqualTo(RefresherState.SCHEDULED);
        assertThat(profile.sources().keySet()).containsExactly(
                SourceId.DIGITAL_FOOTPRINT, SourceId.DEVICE_PROFILE, SourceId.LOCATION, SourceId.UTILITY);
        assertThat(profile.countWithStatus(SourceStatus.SUCCESS)).isEqualTo(4);
        assertThat(session.locationPermission()).isEqualTo(LocationPermissionState.GRANTED);
        assertThat(assessment.confidence()).isEqualTo(1.0);
        assertThat(assessment.basis()).isEqualTo(AssessmentBasis.LOCAL_FALLBACK);
        assertThat(assessment.cycleId()).isEqualTo(profile.cycleId());
        assertThat(session.lastAssessment()).isEqualTo(assessment);

        session.revoke();

        assertThat(session.profile()).isNull();
        assertThat(session.lastAssessment()).isNull();
        assertThat(session.refresherState()).isEqualTo(RefresherState.STOPPED);
    }

    @Test
    @DisplayName("Should resume consent and results persisted by an earlier session")
    void resumesPersistedState() {
        CollectionSession first = open("c");
        first.reportSignals(fullSignals());
        first.requestConsent(ConsentPurpose.CREDIT_ASSESSMENT, null, false, ConsentPrompt.answered(true)).join();
        CompositeProfile profile = first.collectAll();
        first.dispose();

        CollectionSession second = open("c");

        assertThat(second.hasConsent()).isTrue();
        assertThat(second.profile()).isEqualTo(profile);
        assertThat(second.refresherState()).isEqualTo(RefresherState.SCHEDULED);
    }
}
