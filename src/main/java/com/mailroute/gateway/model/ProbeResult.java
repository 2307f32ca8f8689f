package com.mailroute.gateway.model;

/** Outcome of a connectivity probe. No message is sent. */
public final class ProbeResult {

    private static final ProbeResult OK = new ProbeResult(true, null);

    private final boolean ok;
    private final String  error;

    private ProbeResult(final boolean ok, final String error) {
        this.ok    = ok;
        this.error = error;
    }

    public static ProbeResult ok() { return OK; }

    public static ProbeResult failed(final String error) {
        return new ProbeResult(false, error);
    }

    public boolean isOk()     { return ok; }
    public String  getError() { return error; }

    @Override
    public String toString() {
        return ok ? "ProbeResult{ok}" : "ProbeResult{failed: " + error + "}";
    }
}
