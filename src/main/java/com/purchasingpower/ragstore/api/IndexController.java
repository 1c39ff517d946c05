package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.index.IndexRegistry;
import com.purchasingpower.ragstore.model.IndexPatch;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for index management.
 */
@Slf4j
@RestController
@RequestMapping("/api/indexes")
@RequiredArgsConstructor
public class IndexController {

    private final IndexRegistry indexRegistry;

    /**
     * Create an index.
     *
     * POST /api/indexes
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<IndexResponse>> createIndex(@Valid @RequestBody CreateIndexRequest request) {
        log.info("Creating index: {}", request.getName());
        return indexRegistry.create(request.getName(), request.getDimension(), request.getDescription())
            .thenApply(index -> ResponseEntity.status(HttpStatus.CREATED).body(IndexResponse.from(index)));
    }

    /**
     * List indexes ordered by name.
     *
     * GET /api/indexes?offset=0&amp;limit=20
     */
    @GetMapping
    public CompletableFuture<List<IndexResponse>> listIndexes(@RequestParam(required = false) Integer offset,
                                                              @RequestParam(required = false) Integer limit) {
        return indexRegistry.list(offset, limit)
            .thenApply(indexes -> indexes.stream().map(IndexResponse::from).toList());
    }

    /**
     * GET /api/indexes/{name}
     */
    @GetMapping("/{name}")
    public CompletableFuture<IndexResponse> getIndex(@PathVariable String name) {
        return indexRegistry.get(name).thenApply(IndexResponse::from);
    }

    /**
     * PUT /api/indexes/{name}
     */
    @PutMapping("/{name}")
    public CompletableFuture<IndexResponse> updateIndex(@PathVariable String name,
                                                        @Valid @RequestBody UpdateIndexRequest request) {
        IndexPatch patch = IndexPatch.builder()
            .description(request.getDescription())
            .build();
        return indexRegistry.update(name, patch).thenApply(IndexResponse::from);
    }

    /**
     * Delete an index with all of its documents and relationships.
     *
     * DELETE /api/indexes/{name}
     */
    @DeleteMapping("/{name}")
    public CompletableFuture<ResponseEntity<Void>> deleteIndex(@PathVariable String name) {
        log.info("Deleting index: {}", name);
        return indexRegistry.delete(name).thenApply(done -> ResponseEntity.noContent().build());
    }
}
