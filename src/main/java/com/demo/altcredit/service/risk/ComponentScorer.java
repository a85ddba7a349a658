package com.demo.altcredit.service.risk;

import com.demo.altcredit.service.collect.SourceId;

import java.util.Map;

/** Turns one source's normalized payload into a 0–100 risk contribution (higher is riskier). */
public interface ComponentScorer {

    SourceId source();

    int score(Map<String, Object> payload);
}
