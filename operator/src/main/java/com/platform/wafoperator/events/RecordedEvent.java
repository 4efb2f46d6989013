package com.platform.wafoperator.events;

import com.platform.wafoperator.model.ObjectKey;

import java.time.Instant;

/**
 * Event as emitted by the operator, kept for the operations API.
 */
public record RecordedEvent(
    Instant timestamp,
    String kind,
    ObjectKey involvedObject,
    EventType type,
    String reason,
    String message
) {
}
