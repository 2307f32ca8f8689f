package com.mailroute.gateway.store;

/** Recorded preference of a recipient for one task category. */
public enum ConsentStatus {
    GRANTED,
    REVOKED,
    UNKNOWN
}
