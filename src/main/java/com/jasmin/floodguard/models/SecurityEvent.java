package com.jasmin.floodguard.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observed request, attributed to its origin. Folded into the sliding window and then dropped.
 */
@Value
@Builder
public class SecurityEvent {
    String sourceKey;
    Instant timestamp;
}
