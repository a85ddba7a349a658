package com.demo.altcredit.service.consent;

/** Read-only view of the consent decision, handed to everything that is not the gate. */
@FunctionalInterface
public interface ConsentState {
    boolean hasConsent();

    /** Advances on every revocation. Work started under one epoch must not publish under another. */
    default long epoch() {
        return 0L;
    }

    /** True while consent holds and no revocation happened since {@code epoch} was read. */
    default boolean heldSince(long epoch) {
        return hasConsent() && epoch() == epoch;
    }
}
