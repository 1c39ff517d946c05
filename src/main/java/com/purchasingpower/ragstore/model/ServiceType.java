package com.purchasingpower.ragstore.model;

/**
 * Enumeration of external service types for unified logging.
 *
 * @see com.purchasingpower.ragstore.util.ExternalCallLogger
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    EMBEDDING("🔵", "Embedding");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
