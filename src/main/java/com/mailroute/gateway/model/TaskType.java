package com.mailroute.gateway.model;

/**
 * Why a message is being sent. Selects the routing row and the consent policy.
 */
public enum TaskType {

    SYSTEM_EMAILS        (ConsentPolicy.OPT_OUT),
    AUTH_EMAILS          (ConsentPolicy.ALWAYS),
    TRANSACTIONAL_EMAILS (ConsentPolicy.ALWAYS),
    ONBOARDING_EMAILS    (ConsentPolicy.OPT_OUT),
    NOTIFICATION_EMAILS  (ConsentPolicy.OPT_OUT),
    MARKETING_EMAILS     (ConsentPolicy.OPT_IN),
    SUPPORT_EMAILS       (ConsentPolicy.OPT_OUT),
    BILLING_EMAILS       (ConsentPolicy.OPT_OUT),
    REPORT_EMAILS        (ConsentPolicy.OPT_OUT);

    /** How recipient consent is evaluated for a task category. */
    public enum ConsentPolicy {
        /** Delivered regardless of recorded preferences. */
        ALWAYS,
        /** Requires an explicit recorded opt-in. */
        OPT_IN,
        /** Delivered unless the recipient explicitly opted out. */
        OPT_OUT
    }

    private final ConsentPolicy consentPolicy;

    TaskType(final ConsentPolicy consentPolicy) {
        this.consentPolicy = consentPolicy;
    }

    public ConsentPolicy getConsentPolicy() { return consentPolicy; }
}
