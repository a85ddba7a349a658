package com.demo.altcredit.service.risk.scorers;

import com.demo.altcredit.service.collect.SourceId;
import com.demo.altcredit.service.risk.ComponentScorer;
import com.demo.altcredit.service.risk.RiskBand;

import java.util.Map;

import static com.demo.altcredit.service.collect.collectors.DigitalFootprintCollector.*;

/** Ownership stability band plus emulator, biometric and inferred payment-method adjustments. */
public class DigitalFootprintScorer implements ComponentScorer {

    @Override
    public SourceId source() {
        return SourceId.DIGITAL_FOOTPRINT;
    }

    @Override
    public int score(Map<String, Object> payload) {
        int risk = bandRisk(Payloads.text(payload, OWNERSHIP_STABILITY));
        if (Boolean.TRUE.equals(Payloads.flag(payload, IS_EMULATOR))) risk += 15;
        if (Boolean.FALSE.equals(Payloads.flag(payload, BIOMETRIC_ENABLED))) risk += 5;
        if (Payloads.size(payload, PAYMENT_METHODS) == 0) risk += 10;
        return RiskBand.clamp(risk);
    }

    private int bandRisk(String stability) {
        if (stability == null) return 40;
        switch (stability) {
            case "very_stable": return 10;
            case "stable":      return 20;
            case "moderate":    return 35;
            case "new":         return 55;
            default:            return 75;
        }
    }
}
