package com.questrail.wsclient.observability;

import com.questrail.wsclient.api.ClientStatus;

import java.time.Instant;

/**
 * Record representing a change of {@link ClientStatus}.
 */
public record ClientStateTransitionEvent(
    Instant timestamp,
    ClientStatus oldStatus,
    ClientStatus newStatus
) {
}
