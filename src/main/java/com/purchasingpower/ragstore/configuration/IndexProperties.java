package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class IndexProperties {

    /**
     * Dimension given to indexes created without one.
     */
    @Min(1)
    private int defaultDimension = 1536;
}
