package com.purchasingpower.ragstore.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A named, isolated partition of the store with a fixed embedding dimension.
 *
 * <p>The name is the partition key of every chunk and relationship owned by
 * the index; it never changes after creation.
 */
@Value
@Builder(toBuilder = true)
public class RagIndex {
    String name;
    int dimension;
    String description;
    Instant createdAt;
    Instant updatedAt;
}
