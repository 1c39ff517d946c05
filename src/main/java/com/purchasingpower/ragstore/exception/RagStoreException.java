package com.purchasingpower.ragstore.exception;

import lombok.Getter;

/**
 * Base type for every failure the store reports to its callers.
 */
@Getter
public abstract class RagStoreException extends RuntimeException {

    private final ErrorCode errorCode;

    protected RagStoreException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RagStoreException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
