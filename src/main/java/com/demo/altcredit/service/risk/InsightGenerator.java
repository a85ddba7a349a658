package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.CompositeProfile;
import com.demo.altcredit.service.collect.ErrorKind;
import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.collect.SourceResult;
import com.demo.altcredit.service.collect.SourceStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rule-based insight and recommendation text. Output follows the profile's source order so
 * the same inputs always produce the same lists.
 */
public class InsightGenerator {

    static final String LOW_DATA_QUALITY = "Limited data quality - consider additional verification steps";
    static final double LOW_CONFIDENCE = 0.6;

    public record Narrative(List<String> insights, List<String> recommendations) {}

    public Narrative describe(CompositeProfile profile, Map<SourceId, Integer> componentScores, double confidence) {
        List<String> insights = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        if (confidence < LOW_CONFIDENCE) recommendations.add(LOW_DATA_QUALITY);

        for (Map.Entry<SourceId, SourceResult> e : profile.sources().entrySet()) {
            SourceId id = e.getKey();
            Integer score = componentScores.get(id);
            if (score != null) {
                RiskBand band = RiskBand.of(score);
                insights.add(insight(id, band, score));
                String rec = recommendation(id, band);
                if (rec != null) recommendations.add(rec);
            } else {
                String rec = missingSource(id, e.getValue());
                if (rec != null) recommendations.add(rec);
            }
        }
        return new Narrative(insights, recommendations);
    }

    private String insight(SourceId id, RiskBand band, int score) {
        String level;
        switch (band) {
            case LOW:    level = "low risk"; break;
            case MEDIUM: level = "medium risk"; break;
            default:     level = "high risk";
        }
        String detail;
        switch (id) {
            case DIGITAL_FOOTPRINT:
                detail = band == RiskBand.LOW ? "established device ownership and payment activity"
                        : band == RiskBand.MEDIUM ? "limited device history or payment indicators"
                        : "very recent device ownership or missing payment indicators";
                break;
            case DEVICE_PROFILE:
                detail = band == RiskBand.LOW ? "device security features are in place"
                        : band == RiskBand.MEDIUM ? "some device security features are missing"
                        : "device integrity concerns (emulator, rooting or no screen lock)";
                break;
            case LOCATION:
                detail = band == RiskBand.LOW ? "consistent coarse location"
                        : band == RiskBand.MEDIUM ? "imprecise location signal"
                        : "location signal looks spoofed or unreliable";
                break;
            case UTILITY:
                detail = band == RiskBand.LOW ? "stable connectivity and recurring service usage"
                        : band == RiskBand.MEDIUM ? "irregular connectivity or few recurring services"
                        : "unstable connectivity and no recurring services detected";
                break;
            default:
                detail = "score " + score;
        }
        return id.label() + ": " + level + " (" + score + ") - " + detail;
    }

    private String recommendation(SourceId id, RiskBand band) {
        if (band == RiskBand.LOW) return null;
        switch (id) {
            case DIGITAL_FOOTPRINT:
                return "Verify identity with an additional document; device history is short";
            case DEVICE_PROFILE:
                return band == RiskBand.HIGH
                        ? "Require step-up verification; device integrity is questionable"
                        : "Encourage enabling a screen lock or biometric authentication";
            case LOCATION:
                return "Confirm residence region through an alternative check";
            case UTILITY:
                return "Request utility or subscription payment history for verification";
            default:
                return null;
        }
    }

    private String missingSource(SourceId id, SourceResult result) {
        SourceStatus status = result.status();
        if (status == SourceStatus.PERMISSION_DENIED) {
            boolean blocked = result.error() != null && result.error().kind() == ErrorKind.PERMISSION_BLOCKED;
            return blocked
                    ? "Enable " + id.label().toLowerCase() + " access in device settings to improve assessment accuracy"
                    : "Grant " + id.label().toLowerCase() + " access to improve assessment accuracy";
        }
        if (status == SourceStatus.TIMED_OUT || status == SourceStatus.FAILED) {
            return "Retry collection: " + id.label().toLowerCase() + " data was unavailable";
        }
        return null;
    }
}
