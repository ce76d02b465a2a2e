package com.jasmin.floodguard.services.ingestion;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    /** Events buffered between ingest and the window counter. New events are dropped once full. */
    @Min(1) private int pendingCapacity = 100_000;

    /** Max events folded into the window per drain pass. */
    @Min(1) private int drainBatchSize = 10_000;

    /** Clock skew tolerated for event timestamps ahead of the local clock. */
    @Min(0) private long maxFutureSkewMillis = 0;

    public Duration maxFutureSkew() {
        return Duration.ofMillis(maxFutureSkewMillis);
    }
}
