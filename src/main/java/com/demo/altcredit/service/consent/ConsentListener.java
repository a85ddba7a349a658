package com.demo.altcredit.service.consent;

public interface ConsentListener {

    default void onConsentGranted(ConsentRecord record) {}

    default void onConsentRevoked(ConsentRecord record) {}
}
