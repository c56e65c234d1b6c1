package com.myorg.esf.contracts.core.event;

import java.util.UUID;

/**
 * One stored event that could not be decoded into its declared kind.
 */
public record EventReadFailure(
        UUID aggregateId,
        long version,
        String eventKind,
        String reason
) {
    @Override
    public String toString() {
        return "aggregateId=" + aggregateId + " version=" + version + " eventKind=" + eventKind + " reason=" + reason;
    }
}
