package com.jasmin.floodguard.detectors.burst;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.burst")
public class BurstProperties {

    /** Per-tick request rates, current tick included, that the burstiness is computed over. */
    @Min(2) private int sampleCount = 10;

    /** Burstiness at or below this scores 0. */
    @DecimalMin("0.0") private double threshold = 1.0;

    /**
     * Burstiness that scores 1. With n samples the coefficient of variation is at most sqrt(n - 1),
     * so 3.0 is the ceiling for the default of 10 samples.
     */
    @Positive private double ceiling = 3.0;
}
