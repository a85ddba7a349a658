package com.demo.altcredit.service.consent;

import java.util.concurrent.CompletableFuture;

/**
 * Presents the explanation to the user in whatever modality the caller owns (dialog, page,
 * native prompt) and completes with the decision.
 */
@FunctionalInterface
public interface ConsentPrompt {

    CompletableFuture<Boolean> ask(ConsentPurpose purpose, String explanation);

    /** For callers that already hold the user's answer. */
    static ConsentPrompt answered(boolean decision) {
        return (purpose, explanation) -> CompletableFuture.completedFuture(decision);
    }
}
