package com.purchasingpower.ragstore.document;

import com.purchasingpower.ragstore.exception.ErrorCode;
import com.purchasingpower.ragstore.model.DocumentChunk;
import lombok.Value;

/**
 * Outcome of one item of a batch ingestion: either the stored chunk or an
 * error code with detail.
 */
@Value
public class BatchItemResult {
    int position;
    DocumentChunk document;
    ErrorCode error;
    String detail;

    public static BatchItemResult created(int position, DocumentChunk document) {
        return new BatchItemResult(position, document, null, null);
    }

    public static BatchItemResult failed(int position, ErrorCode error, String detail) {
        return new BatchItemResult(position, null, error, detail);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
