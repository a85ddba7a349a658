package com.demo.altcredit.service.consent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/** The user's consent decision. Replaced, never mutated, by {@link ConsentGate}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsentRecord(
        boolean granted,
        ConsentPurpose scope,
        Instant grantedAt,
        Instant revokedAt
) {

    /** State before any decision was taken. */
    public static ConsentRecord undecided() {
        return new ConsentRecord(false, null, null, null);
    }

    public static ConsentRecord grantedFor(ConsentPurpose scope, Instant at) {
        return new ConsentRecord(true, scope, at, null);
    }

    public ConsentRecord deniedFor(ConsentPurpose scope) {
        return new ConsentRecord(false, scope, grantedAt, revokedAt);
    }

    public ConsentRecord revokedAt(Instant at) {
        return new ConsentRecord(false, scope, grantedAt, granted ? at : revokedAt);
    }
}
