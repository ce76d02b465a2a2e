package com.jasmin.floodguard.services.mitigation;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "mitigation")
public class MitigationProperties {
    private boolean enabled = true;
    private String keyPrefix = "fg";

    // Score thresholds
    @DecimalMin("0.0") @DecimalMax("1.0") private double rateLimitThreshold = 0.4;
    @DecimalMin("0.0") @DecimalMax("1.0") private double challengeThreshold = 0.6;
    @DecimalMin("0.0") @DecimalMax("1.0") private double blockThreshold = 0.8;

    // Escalation
    /** Rate limits beyond this count escalate to a challenge. */
    @Min(1) private int rateLimitEscalationStrikes = 5;
    /** A challenge escalates to a block above this score ... */
    @DecimalMin("0.0") @DecimalMax("1.0") private double challengeBlockScore = 0.7;
    /** ... or once the source has been rate limited more than this many times. */
    @Min(1) private int challengeBlockStrikes = 10;

    @Min(1) private int blockDurationSeconds = 3600;

    /** Entries popped from the threat queue per mitigation pass. */
    @Min(1) private int drainBatchSize = 500;

    /** Recent actions kept for the status view. */
    @Min(1) private int recentActionsLimit = 1000;

    private boolean publishAlerts = true;

    public Duration blockDuration() {
        return Duration.ofSeconds(blockDurationSeconds);
    }
}
