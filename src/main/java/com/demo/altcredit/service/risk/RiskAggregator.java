package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.SourceResult;
import com.demo.altcredit.service.risk.dto.RemoteAssessmentResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives a {@link RiskAssessment} from one profile snapshot.
 *
 * <p>Only SUCCESS and PARTIAL sources are scored. Missing or failed sources are left out and
 * the weights of the others renormalized; they lower {@code confidence}, which is the share
 * of sources in the profile that completed with SUCCESS. A remote backend score, when one is
 * obtained, replaces the local weighted sum.</p>
 */
@Slf4j
public class RiskAggregator {

    private final Map<SourceId, ComponentScorer> scorers;
    private final WeightTable weights;
    private final InsightGenerator insightGenerator;
    private final ScoringBackendClient backend;
    private final Clock clock;

    public RiskAggregator(List<ComponentScorer> scorers, WeightTable weights, InsightGenerator insightGenerator,
                          ScoringBackendClient backend, Clock clock) {
        Map<SourceId, ComponentScorer> byId = new EnumMap<>(SourceId.class);
        for (ComponentScorer s : scorers) byId.put(s.source(), s);
        this.scorers = byId;
        this.weights = weights;
        this.insightGenerator = insightGenerator;
        this.backend = backend;
        this.clock = clock;
    }

    public RiskAssessment computeRisk(CompositeProfile profile) {
        if (profile == null) throw new InsufficientDataException("No collected profile available");

        Map<SourceId, Integer> local = componentScores(profile);
        double confidence = confidence(profile);

        RemoteAssessmentResponse remote = callBackend(profile);
        if (remote != null) {
            Map<SourceId, Integer> components = remoteComponents(remote);
            if (components.isEmpty()) components = local;
            InsightGenerator.Narrative narrative = insightGenerator.describe(profile, components, confidence);
            return new RiskAssessment(
                    RiskBand.clamp(remote.getOverallScore()),
                    components,
                    confidence,
                    nonEmptyOr(remote.getInsights(), narrative.insights()),
                    nonEmptyOr(remote.getRecommendations(), narrative.recommendations()),
                    clock.instant(),
                    AssessmentBasis.REMOTE,
                    profile.cycleId());
        }

        if (local.isEmpty()) {
            throw new InsufficientDataException("No source produced scorable data and the scoring backend is unavailable");
        }
        InsightGenerator.Narrative narrative = insightGenerator.describe(profile, local, confidence);
        return new RiskAssessment(
                weights.combine(local),
                local,
                confidence,
                narrative.insights(),
                narrative.recommendations(),
                clock.instant(),
                AssessmentBasis.LOCAL_FALLBACK,
                profile.cycleId());
    }

    Map<SourceId, Integer> componentScores(CompositeProfile profile) {
        Map<SourceId, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<SourceId, SourceResult> e : profile.sources().entrySet()) {
            SourceResult r = e.getValue();
            if (!r.status().scorable()) continue;
            ComponentScorer scorer = scorers.get(e.getKey());
            if (scorer == null || weights.weightOf(e.getKey()) <= 0) continue;
            out.put(e.getKey(), RiskBand.clamp(scorer.score(r.payload())));
        }
        return out;
    }

    static double confidence(CompositeProfile profile) {
        int total = profile.sources().size();
        if (total == 0) return 0.0;
        long ok = profile.sources().values().stream().filter(SourceResult::succeeded).count();
        return (double) ok / total;
    }

    private RemoteAssessmentResponse callBackend(CompositeProfile profile) {
        if (backend == null || !backend.isConfigured()) return null;
        try {
            return backend.assess(profile);
        } catch (BackendUnreachableException ex) {
            log.warn("Falling back to local scoring: {}", ex.getMessage());
            return null;
        }
    }

    private Map<SourceId, Integer> remoteComponents(RemoteAssessmentResponse remote) {
        Map<SourceId, Integer> out = new LinkedHashMap<>();
        if (remote.getComponentScores() == null) return out;
        remote.getComponentScores().forEach((key, value) -> {
            if (value == null) return;
            SourceId.fromKey(key).ifPresentOrElse(
                    id -> out.put(id, RiskBand.clamp(value)),
                    () -> log.debug("Ignoring unknown remote component {}", key));
        });
        return out;
    }

    private static List<String> nonEmptyOr(List<String> preferred, List<String> fallback) {
        return preferred == null || preferred.isEmpty() ? fallback : preferred;
    }
}
