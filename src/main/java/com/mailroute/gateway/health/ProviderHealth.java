package com.mailroute.gateway.health;

import java.time.Instant;

/**
 * Point-in-time view of one provider's counters, as served by
 * {@code /health/providers}. Contains no configuration or credentials.
 */
public final class ProviderHealth {

    private final String  providerId;
    private final String  providerName;
    private final boolean active;
    private final boolean canSend;
    private final int     hourlyCount;
    private final int     maxPerHour;
    private final int     dailyCount;
    private final int     maxPerDay;
    private final int     consecutiveFailures;
    private final long    totalSent;
    private final long    totalFailed;
    private final Instant lastUsedAt;
    private final Instant lastErrorAt;
    private final String  lastErrorMessage;

    ProviderHealth(
            final String providerId,
            final String providerName,
            final boolean active,
            final boolean canSend,
            final int hourlyCount,
            final int maxPerHour,
            final int dailyCount,
            final int maxPerDay,
            final int consecutiveFailures,
            final long totalSent,
            final long totalFailed,
            final Instant lastUsedAt,
            final Instant lastErrorAt,
            final String lastErrorMessage) {
        this.providerId          = providerId;
        this.providerName        = providerName;
        this.active              = active;
        this.canSend             = canSend;
        this.hourlyCount         = hourlyCount;
        this.maxPerHour          = maxPerHour;
        this.dailyCount          = dailyCount;
        this.maxPerDay           = maxPerDay;
        this.consecutiveFailures = consecutiveFailures;
        this.totalSent           = totalSent;
        this.totalFailed         = totalFailed;
        this.lastUsedAt          = lastUsedAt;
        this.lastErrorAt         = lastErrorAt;
        this.lastErrorMessage    = lastErrorMessage;
    }

    public String  getProviderId()          { return providerId; }
    public String  getProviderName()        { return providerName; }
    public boolean isActive()               { return active; }
    public boolean canSend()                { return canSend; }
    public int     getHourlyCount()         { return hourlyCount; }
    public int     getMaxPerHour()          { return maxPerHour; }
    public int     getDailyCount()          { return dailyCount; }
    public int     getMaxPerDay()           { return maxPerDay; }
    public int     getConsecutiveFailures() { return consecutiveFailures; }
    public long    getTotalSent()           { return totalSent; }
    public long    getTotalFailed()         { return totalFailed; }
    public Instant getLastUsedAt()          { return lastUsedAt; }
    public Instant getLastErrorAt()         { return lastErrorAt; }
    public String  getLastErrorMessage()    { return lastErrorMessage; }

    public boolean isHealthy() {
        return consecutiveFailures < ProviderHealthTracker.FAILURE_THRESHOLD;
    }

    @Override
    public String toString() {
        return "ProviderHealth{" + providerId
             + ", canSend=" + canSend
             + ", hourly=" + hourlyCount + "/" + maxPerHour
             + ", daily=" + dailyCount + "/" + maxPerDay
             + ", failures=" + consecutiveFailures + "}";
    }
}
