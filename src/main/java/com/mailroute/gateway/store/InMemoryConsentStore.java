package com.mailroute.gateway.store;

import com.mailroute.gateway.model.TaskType;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Consent preferences held in memory, seeded from {@code mail.consent}.
 * Thread-safe.
 */
public class InMemoryConsentStore implements ConsentStore {

    private final Map<String, ConsentStatus> preferences = new ConcurrentHashMap<>();

    @Override
    public ConsentStatus lookup(final String userId, final TaskType taskType) {
        if (userId == null) return ConsentStatus.UNKNOWN;
        return preferences.getOrDefault(key(userId, taskType), ConsentStatus.UNKNOWN);
    }

    public void record(final String userId, final TaskType taskType, final ConsentStatus status) {
        preferences.put(key(userId, taskType), status);
    }

    /** Record the same status for every task category. */
    public void recordAll(final String userId, final ConsentStatus status) {
        for (final TaskType t : TaskType.values()) {
            record(userId, t, status);
        }
    }

    public int size() {
        return preferences.size();
    }

    private static String key(final String userId, final TaskType taskType) {
        return userId + '|' + taskType.name();
    }
}
