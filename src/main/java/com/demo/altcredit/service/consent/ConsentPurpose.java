package com.demo.altcredit.service.consent;

public enum ConsentPurpose {
    CREDIT_ASSESSMENT("To offer you loan terms we analyze device usage patterns, approximate location, "
            + "payment behavior indicators and security features. Data is used only for credit assessment "
            + "and you can revoke at any time."),
    FRAUD_PREVENTION("Location information helps us detect and prevent fraudulent activity by verifying that "
            + "your application is genuine. Only coarse location is collected."),
    SERVICE_AVAILABILITY("We check your general area to confirm our services are available in your region. "
            + "Only your approximate location is used."),
    BRANCH_LOCATOR("We use your approximate location to find the nearest branches and ATMs. "
            + "Only city-level location is used.");

    private final String defaultExplanation;

    ConsentPurpose(String defaultExplanation) {
        this.defaultExplanation = defaultExplanation;
    }

    public String defaultExplanation() {
        return defaultExplanation;
    }
}
