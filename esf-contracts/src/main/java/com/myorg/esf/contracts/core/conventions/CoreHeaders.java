package com.myorg.esf.contracts.core.conventions;

public final class CoreHeaders {
    private CoreHeaders() {}

    public static final String EVENT_ID = "esf-event-id";
    public static final String EVENT_KIND = "esf-event-kind";
    public static final String AGGREGATE_ID = "esf-aggregate-id";
    public static final String AGGREGATE_VERSION = "esf-aggregate-version";
    public static final String CORRELATION_ID = "esf-correlation-id";
}
