package com.signalengine.lease;

import java.time.Instant;

/**
 * A held lease: {@code ownerId} holds exclusivity of {@code workflowClass} until {@code expiresAt}.
 */
public record ActiveWorkflowMarker(String workflowClass, String ownerId, Instant acquiredAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
