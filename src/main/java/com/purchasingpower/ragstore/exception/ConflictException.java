package com.purchasingpower.ragstore.exception;

public class ConflictException extends RagStoreException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public static ConflictException indexExists(String name) {
        return new ConflictException("Index already exists: " + name);
    }
}
