package com.purchasingpower.ragstore.document;

import lombok.Value;

import java.util.List;

/**
 * Per-position outcomes of a batch ingestion, in request order.
 */
@Value
public class BatchIngestResult {
    List<BatchItemResult> items;

    public boolean isFullSuccess() {
        return items.stream().allMatch(BatchItemResult::isSuccess);
    }

    public long getCreatedCount() {
        return items.stream().filter(BatchItemResult::isSuccess).count();
    }
}
