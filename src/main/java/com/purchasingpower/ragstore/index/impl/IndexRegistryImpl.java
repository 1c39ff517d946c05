package com.purchasingpower.ragstore.index.impl;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.configuration.AsyncConfig;
import com.purchasingpower.ragstore.exception.NotFoundException;
import com.purchasingpower.ragstore.exception.ValidationException;
import com.purchasingpower.ragstore.index.IndexRegistry;
import com.purchasingpower.ragstore.model.IndexPatch;
import com.purchasingpower.ragstore.model.RagIndex;
import com.purchasingpower.ragstore.storage.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class IndexRegistryImpl implements IndexRegistry {

    static final int MAX_NAME_LENGTH = 120;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final DocumentStore store;
    private final Executor storeExecutor;
    private final int defaultDimension;

    public IndexRegistryImpl(DocumentStore store,
                             AppProperties props,
                             @Qualifier(AsyncConfig.STORE_EXECUTOR) Executor storeExecutor) {
        this.store = store;
        this.storeExecutor = storeExecutor;
        this.defaultDimension = props.getIndex().getDefaultDimension();
    }

    @Override
    public CompletableFuture<RagIndex> create(String name, Integer dimension, String description) {
        try {
            validateName(name);
            validateDimension(dimension);
            validateDescription(description);
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }

        Instant now = Instant.now();
        RagIndex index = RagIndex.builder()
            .name(name)
            .dimension(dimension != null ? dimension : defaultDimension)
            .description(description)
            .createdAt(now)
            .updatedAt(now)
            .build();

        return CompletableFuture.supplyAsync(() -> {
            RagIndex created = store.createIndex(index);
            log.info("📁 Created index '{}' (dimension={})", created.getName(), created.getDimension());
            return created;
        }, storeExecutor);
    }

    @Override
    public CompletableFuture<RagIndex> get(String name) {
        return CompletableFuture.supplyAsync(
            () -> store.findIndex(name).orElseThrow(() -> NotFoundException.index(name)), storeExecutor);
    }

    @Override
    public CompletableFuture<List<RagIndex>> list(Integer offset, Integer limit) {
        if (offset != null && offset < 0) {
            return CompletableFuture.failedFuture(new ValidationException("offset must not be negative"));
        }
        if (limit != null && limit < 1) {
            return CompletableFuture.failedFuture(new ValidationException("limit must be at least 1"));
        }
        int skip = offset != null ? offset : 0;
        return CompletableFuture.supplyAsync(() -> {
            List<RagIndex> all = store.listIndexes();
            int from = Math.min(skip, all.size());
            int to = limit != null ? Math.min(all.size(), from + limit) : all.size();
            return List.copyOf(all.subList(from, to));
        }, storeExecutor);
    }

    @Override
    public CompletableFuture<RagIndex> update(String name, IndexPatch patch) {
        try {
            validateDescription(patch.getDescription());
        } catch (ValidationException e) {
            return CompletableFuture.failedFuture(e);
        }
        return CompletableFuture.supplyAsync(() -> store.updateIndex(name, patch, Instant.now()), storeExecutor);
    }

    @Override
    public CompletableFuture<Void> delete(String name) {
        return CompletableFuture.runAsync(() -> {
            store.deleteIndex(name);
            log.info("🗑️ Deleted index '{}'", name);
        }, storeExecutor);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Index name must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Index name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    private static void validateDimension(Integer dimension) {
        if (dimension != null && dimension <= 0) {
            throw new ValidationException("dimension must be positive, got " + dimension);
        }
    }

    private static void validateDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }
}
