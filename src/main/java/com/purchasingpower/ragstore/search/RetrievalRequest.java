package com.purchasingpower.ragstore.search;

import com.purchasingpower.ragstore.model.IndexSnapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a {@link RetrievalStrategy} needs to rank one index.
 */
@Value
@Builder
public class RetrievalRequest {
    IndexSnapshot snapshot;
    List<Double> queryVector;

    /**
     * Lower-cased, distinct keyword terms.
     */
    List<String> terms;

    int topK;
}
