package com.purchasingpower.ragstore.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RagStoreException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String indexName, int expected, int actual) {
        super(ErrorCode.DIMENSION_MISMATCH,
            String.format("Embedding has %d dimensions but index '%s' requires %d", actual, indexName, expected));
        this.expected = expected;
        this.actual = actual;
    }
}
