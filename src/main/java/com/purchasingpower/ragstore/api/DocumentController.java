package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.document.ChunkStore;
import com.purchasingpower.ragstore.model.DocumentDraft;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for the documents (chunks) of one index.
 */
@Slf4j
@RestController
@RequestMapping("/api/indexes/{indexName}/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final ChunkStore chunkStore;

    /**
     * POST /api/indexes/{indexName}/documents
     */
    @PostMapping
    public CompletableFuture<ResponseEntity<DocumentResponse>> createDocument(@PathVariable String indexName,
                                                                              @Valid @RequestBody DocumentRequest request) {
        return chunkStore.createDocument(indexName, request.toDraft())
            .thenApply(chunk -> ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(chunk)));
    }

    /**
     * Batch ingestion: 201 when every item was stored, 207 otherwise.
     *
     * POST /api/indexes/{indexName}/documents/batch
     */
    @PostMapping("/batch")
    public CompletableFuture<ResponseEntity<BatchDocumentResponse>> createDocuments(
            @PathVariable String indexName,
            @Valid @RequestBody BatchDocumentRequest request) {
        List<DocumentDraft> drafts = request.getDocuments().stream().map(DocumentRequest::toDraft).toList();
        log.info("Batch ingest of {} documents into {}", drafts.size(), indexName);
        return chunkStore.createDocuments(indexName, drafts)
            .thenApply(result -> ResponseEntity
                .status(result.isFullSuccess() ? HttpStatus.CREATED : HttpStatus.MULTI_STATUS)
                .body(BatchDocumentResponse.from(result)));
    }

    /**
     * Documents of the index, most recently updated first.
     *
     * GET /api/indexes/{indexName}/documents
     */
    @GetMapping
    public CompletableFuture<List<DocumentResponse>> listDocuments(@PathVariable String indexName) {
        return chunkStore.listDocuments(indexName)
            .thenApply(chunks -> chunks.stream().map(DocumentResponse::from).toList());
    }

    @GetMapping("/{docId}")
    public CompletableFuture<DocumentResponse> getDocument(@PathVariable String indexName,
                                                           @PathVariable String docId) {
        return chunkStore.getDocument(indexName, docId).thenApply(DocumentResponse::from);
    }

    @PutMapping("/{docId}")
    public CompletableFuture<DocumentResponse> updateDocument(@PathVariable String indexName,
                                                              @PathVariable String docId,
                                                              @RequestBody UpdateDocumentRequest request) {
        return chunkStore.updateDocument(indexName, docId, request.toPatch()).thenApply(DocumentResponse::from);
    }

    /**
     * Delete a document and every relationship touching it.
     *
     * DELETE /api/indexes/{indexName}/documents/{docId}
     */
    @DeleteMapping("/{docId}")
    public CompletableFuture<ResponseEntity<Void>> deleteDocument(@PathVariable String indexName,
                                                                  @PathVariable String docId) {
        return chunkStore.deleteDocument(indexName, docId).thenApply(done -> ResponseEntity.noContent().build());
    }
}
