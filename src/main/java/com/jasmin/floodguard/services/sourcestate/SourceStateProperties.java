package com.jasmin.floodguard.services.sourcestate;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "source-state")
public class SourceStateProperties {
    /**
     * Maximum number of sources whose state is kept. The least recently used source is evicted beyond this.
     */
    @Min(1) private int capacity = 10_000;
}
