package com.demo.altcredit.service.risk.scorers;

import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.risk.ComponentScorer;
import com.demo.altcredit.service.risk.RiskBand;

import java.util.Map;

import static com.demo.altcredit.service.collect.collectors.DeviceProfileCollector.SECURITY_SCORE;
import static com.demo.altcredit.service.collect.collectors.DeviceProfileCollector.STABILITY_SCORE;

/** 70% inverted security score, 30% inverted stability score. */
public class DeviceSecurityScorer implements ComponentScorer {

    @Override
    public SourceId source() {
        return SourceId.DEVICE_PROFILE;
    }

    @Override
    public int score(Map<String, Object> payload) {
        Double security = Payloads.number(payload, SECURITY_SCORE);
        Double stability = Payloads.number(payload, STABILITY_SCORE);
        if (security == null && stability == null) return 50;
        if (security == null) return RiskBand.clamp((int) Math.round(100 - stability));
        if (stability == null) return RiskBand.clamp((int) Math.round(100 - security));
        return RiskBand.clamp((int) Math.round(0.7 * (100 - security) + 0.3 * (100 - stability)));
    }
}
