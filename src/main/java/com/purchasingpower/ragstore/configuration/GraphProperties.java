package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class GraphProperties {

    /**
     * Number of edges returned in the analytics sample.
     */
    @Min(0)
    private int analyticsSampleSize = 5;
}
