package com.purchasingpower.ragstore.exception;

public class ValidationException extends RagStoreException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
