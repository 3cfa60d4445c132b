package com.memoryvault.application.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per matched pair of principals, after both disclosures
 * have been flipped to matched. Consumed by the notification dispatcher to
 * open the channel between the two.
 */
@Value
public class MutualMatchEvent {
    String firstPrincipalId;
    UUID firstRecordId;
    String secondPrincipalId;
    UUID secondRecordId;
    Instant matchedAt;
}
