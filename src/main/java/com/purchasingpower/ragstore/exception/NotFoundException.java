package com.purchasingpower.ragstore.exception;

public class NotFoundException extends RagStoreException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException index(String name) {
        return new NotFoundException("Index not found: " + name);
    }

    public static NotFoundException document(String indexName, String docId) {
        return new NotFoundException("Document not found: " + docId + " (index " + indexName + ")");
    }

    public static NotFoundException relationship(String source, String relType, String target) {
        return new NotFoundException("Relationship not found: " + source + " -[" + relType + "]-> " + target);
    }
}
