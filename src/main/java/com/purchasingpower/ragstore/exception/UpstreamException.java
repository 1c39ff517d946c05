package com.purchasingpower.ragstore.exception;

/**
 * An upstream call failed with a non-retryable error.
 */
public class UpstreamException extends RagStoreException {

    public UpstreamException(String message) {
        super(ErrorCode.UPSTREAM_ERROR, message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, message, cause);
    }
}
