package com.memoryvault.application.event;

import com.memoryvault.domain.model.AccessLogEntry;
import lombok.Value;

/**
 * Outbound audit stream: one event per access-log append, in append order
 * for any single record.
 */
@Value
public class AccessLogEvent {
    String ownerId;
    AccessLogEntry entry;
}
