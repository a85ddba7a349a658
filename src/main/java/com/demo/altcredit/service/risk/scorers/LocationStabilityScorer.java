package com.demo.altcredit.service.risk.scorers;

import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.risk.ComponentScorer;
import com.demo.altcredit.service.risk.RiskBand;

import java.util.Map;

import static com.demo.altcredit.service.collect.collectors.LocationCollector.*;

public class LocationStabilityScorer implements ComponentScorer {

    @Override
    public SourceId source() {
        return SourceId.LOCATION;
    }

    @Override
    public int score(Map<String, Object> payload) {
        if (Payloads.number(payload, LATITUDE) == null || Payloads.number(payload, LONGITUDE) == null) return 50;
        int risk = 20;
        if (Boolean.TRUE.equals(Payloads.flag(payload, MOCKED))) risk += 50;
        Double accuracy = Payloads.number(payload, ACCURACY);
        if (accuracy != null && accuracy > 5000) risk += 15;
        return RiskBand.clamp(risk);
    }
}
