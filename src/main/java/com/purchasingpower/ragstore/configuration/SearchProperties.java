package com.purchasingpower.ragstore.configuration;

import com.purchasingpower.ragstore.model.SearchMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SearchProperties {

    @NotNull
    private SearchMode strategy = SearchMode.HYBRID;

    /**
     * Weight of the normalized vector signal; keyword overlap gets the rest.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double vectorWeight = 0.6;

    @Min(1)
    private int defaultTopK = 5;

    @Min(1)
    private int maxTopK = 100;

    /**
     * Score multiplier applied to chunks reached through a relationship edge.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double graphNeighbourDecay = 0.5;

    /**
     * Deadline applied when the caller does not supply one.
     */
    @Min(1)
    private long defaultTimeoutMs = 30_000;
}
