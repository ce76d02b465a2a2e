package com.jasmin.floodguard.detectors.slidingwindow;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.sliding-window")
public class SlidingWindowProperties {

    /** Length of the trailing window events are counted over. */
    @Min(1) private int windowSeconds = 10;

    public Duration windowSize() {
        return Duration.ofSeconds(windowSeconds);
    }
}
