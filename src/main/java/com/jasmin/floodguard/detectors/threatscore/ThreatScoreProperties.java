package com.jasmin.floodguard.detectors.threatscore;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.threat-score")
public class ThreatScoreProperties {

    /** Weight of the per-source rate signal. */
    @DecimalMin("0.0") private double rateWeight = 0.6;

    /** Weight of the global entropy anomaly, scaled by the source's share of traffic. */
    @DecimalMin("0.0") private double anomalyWeight = 0.4;

    /** Events per window at which the rate signal saturates to 1. */
    @Min(1) private long rateCeiling = 100;

    /** Factor applied to the previous score of a source; the new score never drops below it. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double decayFactor = 0.85;

    /** Sources scoring at or above this are queued for mitigation. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double reportingThreshold = 0.3;
}
