package com.jasmin.floodguard.detectors.entropy;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.entropy")
public class EntropyProperties {

    /**
     * Reference ceiling for source entropy, in bits. Fixed rather than log2(distinct sources),
     * which an attacker can inflate at will.
     */
    @Positive private double maxEntropyBits = 8.0;

    /** Anomaly score above which traffic is classified HIGH. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double highThreshold = 0.7;

    /** Anomaly score above which traffic is classified MEDIUM. */
    @DecimalMin("0.0") @DecimalMax("1.0") private double mediumThreshold = 0.4;
}
