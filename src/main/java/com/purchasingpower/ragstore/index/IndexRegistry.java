package com.purchasingpower.ragstore.index;

import com.purchasingpower.ragstore.model.IndexPatch;
import com.purchasingpower.ragstore.model.RagIndex;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the set of named indexes and their embedding dimension.
 *
 * <p>Failures are delivered through the returned futures as
 * {@code RagStoreException} subclasses.
 */
public interface IndexRegistry {

    /**
     * Create an index.
     *
     * @param name unique name, 1..120 characters
     * @param dimension embedding length; null uses the configured default
     * @param description optional, at most 500 characters
     */
    CompletableFuture<RagIndex> create(String name, Integer dimension, String description);

    CompletableFuture<RagIndex> get(String name);

    /**
     * Indexes ordered by name.
     *
     * @param offset number of indexes to skip; null means 0
     * @param limit maximum number returned; null means all
     */
    CompletableFuture<List<RagIndex>> list(Integer offset, Integer limit);

    /**
     * Partial update of the description. Name and dimension never change.
     */
    CompletableFuture<RagIndex> update(String name, IndexPatch patch);

    /**
     * Delete the index with all of its documents and relationships.
     */
    CompletableFuture<Void> delete(String name);
}
