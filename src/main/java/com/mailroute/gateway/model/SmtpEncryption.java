package com.mailroute.gateway.model;

public enum SmtpEncryption {
    TLS,   // STARTTLS on a plain port
    SSL,   // implicit TLS
    NONE
}
