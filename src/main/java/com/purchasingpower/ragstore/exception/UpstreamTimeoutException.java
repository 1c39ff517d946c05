package com.purchasingpower.ragstore.exception;

/**
 * An upstream call (embedding endpoint, graph store) did not answer within its
 * retry budget or the caller's deadline.
 */
public class UpstreamTimeoutException extends RagStoreException {

    public UpstreamTimeoutException(String message) {
        super(ErrorCode.UPSTREAM_TIMEOUT, message);
    }

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_TIMEOUT, message, cause);
    }
}
