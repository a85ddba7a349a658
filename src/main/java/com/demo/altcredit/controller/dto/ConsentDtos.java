package com.demo.altcredit.controller.dto;

import com.demo.altcredit.service.consent.ConsentPurpose;
import com.demo.altcredit.service.consent.ConsentRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public final class ConsentDtos {
    private ConsentDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GrantRequest {
        @NotNull
        public ConsentPurpose purpose;
        public String explanation;   // null: the purpose's default text
        public boolean decision;     // the user's answer to the prompt
        public boolean force;        // re-prompt even when already granted
    }

    // -------- Responses ----------
    public static class StatusResponse {
        public boolean granted;
        public ConsentPurpose scope;
        public Instant grantedAt;
        public Instant revokedAt;

        public static StatusResponse of(ConsentRecord r) {
            StatusResponse s = new StatusResponse();
            s.granted = r.granted();
            s.scope = r.scope();
            s.grantedAt = r.grantedAt();
            s.revokedAt = r.revokedAt();
            return s;
        }
    }
}
