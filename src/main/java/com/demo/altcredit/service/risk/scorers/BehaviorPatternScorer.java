package com.demo.altcredit.service.risk.scorers;

import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.risk.ComponentScorer;
import com.demo.altcredit.service.risk.RiskBand;

import java.util.Map;

import static com.demo.altcredit.service.collect.collectors.UtilityCollector.*;

/** Connectivity reliability and subscription footprint from the utility source. */
public class BehaviorPatternScorer implements ComponentScorer {

    @Override
    public SourceId source() {
        return SourceId.UTILITY;
    }

    @Override
    public int score(Map<String, Object> payload) {
        int risk = 30;
        if (Boolean.FALSE.equals(Payloads.flag(payload, CONNECTED))) risk += 15;
        if (Boolean.TRUE.equals(Payloads.flag(payload, EXPENSIVE))) risk += 5;

        Double stability = Payloads.number(payload, CONNECTION_STABILITY);
        if (stability != null) {
            if (stability < 50) risk += 20;
            else if (stability >= 80) risk -= 10;
        }

        int subscriptions = Payloads.size(payload, SUBSCRIPTION_SERVICES);
        if (subscriptions == 0) risk += 10;
        else if (subscriptions >= 2) risk -= 10;
        return RiskBand.clamp(risk);
    }
}
