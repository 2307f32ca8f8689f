package com.mailroute.gateway.store;

import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.TaskRouting;
import com.mailroute.gateway.model.TaskType;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for provider records and the routing table.
 *
 * <p>Implementations must tolerate concurrent calls; the counter updates are
 * invoked from many send threads at once.
 */
public interface ProviderStore {

    Optional<EmailProvider> getProvider(String providerId);

    Optional<TaskRouting> getTaskRouting(TaskType taskType);

    /** All providers ordered by {@code priorityOrder}. */
    List<EmailProvider> listProviders();

    /** Count one successful send against the hourly and daily quota. */
    void incrementRateCounters(String providerId);

    /**
     * Record a send outcome: success resets consecutive failures and bumps
     * {@code totalSent}; failure increments both failure counters and stores
     * the (already sanitised) error text.
     */
    void updateHealth(String providerId, boolean success, String errorMessage);

    /** Clear consecutive failures after an operator intervention. */
    void resetHealth(String providerId);
}
