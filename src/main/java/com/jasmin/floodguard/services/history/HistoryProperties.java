package com.jasmin.floodguard.services.history;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "history")
public class HistoryProperties {
    /**
     * Number of per-tick samples kept. The oldest sample is dropped beyond this.
     */
    @Min(1) private int capacity = 1_000;
}
