package com.mailroute.gateway.store;

import com.mailroute.gateway.model.TaskType;

/**
 * Lookup of recipient email preferences.
 */
public interface ConsentStore {

    /** Never null; {@link ConsentStatus#UNKNOWN} when nothing is recorded. */
    ConsentStatus lookup(String userId, TaskType taskType);

    /** Plain opt-in check: only an explicit {@link ConsentStatus#GRANTED} counts. */
    default boolean hasConsent(final String userId, final TaskType taskType) {
        return lookup(userId, taskType) == ConsentStatus.GRANTED;
    }
}
