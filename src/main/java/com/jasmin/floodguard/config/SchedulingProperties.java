package com.jasmin.floodguard.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "flood-guard.scheduling")
public class SchedulingProperties {
    private boolean enabled = true;

    /** Delay between evaluation ticks. */
    @Min(1) private long evaluationCadenceMillis = 1000;

    /** Delay between passes folding pending events into the window. */
    @Min(1) private long ingestionDrainMillis = 100;

    /** Delay between mitigation passes over the threat queue. */
    @Min(1) private long mitigationCadenceMillis = 1000;
}
