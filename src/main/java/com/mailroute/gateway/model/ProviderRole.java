package com.mailroute.gateway.model;

/**
 * Administrative role of a provider. Informational only: the attempt order is
 * taken from {@link TaskRouting}, never from the role.
 */
public enum ProviderRole {
    PRIMARY,
    SECONDARY,
    FALLBACK
}
