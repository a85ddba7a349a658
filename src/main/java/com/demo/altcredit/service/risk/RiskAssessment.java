package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.SourceId;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Derived from exactly one profile snapshot ({@code cycleId}); a new computation yields a new instance. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskAssessment(
        int overallScore,
        Map<SourceId, Integer> componentScores,
        double confidence,
        List<String> insights,
        List<String> recommendations,
        Instant generatedAt,
        AssessmentBasis basis,
        String cycleId
) {

    public RiskAssessment {
        componentScores = componentScores == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(componentScores));
        insights = insights == null ? List.of() : List.copyOf(insights);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
