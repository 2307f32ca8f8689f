package com.mailroute.gateway.model;

/** Transport family a provider speaks. */
public enum ConnectionType {
    SMTP,
    API,
    WEBHOOK
}
