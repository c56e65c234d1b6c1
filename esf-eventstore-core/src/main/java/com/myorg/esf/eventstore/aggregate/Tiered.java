package com.myorg.esf.eventstore.aggregate;

/**
 * Aggregates that expose a tier (e.g. character level) snapshot more aggressively once it is high.
 */
public interface Tiered {
    int tier();
}
