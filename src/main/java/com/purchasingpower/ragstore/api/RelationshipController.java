package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.graph.RelationshipGraph;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for the relationship graph of one index.
 */
@RestController
@RequestMapping("/api/indexes/{indexName}")
@RequiredArgsConstructor
public class RelationshipController {

    private final RelationshipGraph relationshipGraph;

    /**
     * Declare an edge; declaring it again only updates the reason.
     *
     * POST /api/indexes/{indexName}/relationships
     */
    @PostMapping("/relationships")
    public CompletableFuture<RelationshipResponse> declareRelationship(@PathVariable String indexName,
                                                                       @Valid @RequestBody RelationshipRequest request) {
        return relationshipGraph.declareRelationship(indexName, request.getSourceDocId(),
                request.getTargetDocId(), request.getRelType(), request.getReason())
            .thenApply(RelationshipResponse::from);
    }

    /**
     * GET /api/indexes/{indexName}/relationships?doc_id=...
     */
    @GetMapping("/relationships")
    public CompletableFuture<List<RelationshipResponse>> listRelationships(
            @PathVariable String indexName,
            @RequestParam(name = "doc_id", required = false) String docId) {
        return relationshipGraph.listRelationships(indexName, docId)
            .thenApply(edges -> edges.stream().map(RelationshipResponse::from).toList());
    }

    /**
     * DELETE /api/indexes/{indexName}/relationships?source_doc_id=..&amp;target_doc_id=..&amp;rel_type=..
     */
    @DeleteMapping("/relationships")
    public CompletableFuture<ResponseEntity<Void>> deleteRelationship(
            @PathVariable String indexName,
            @RequestParam(name = "source_doc_id") String sourceDocId,
            @RequestParam(name = "target_doc_id") String targetDocId,
            @RequestParam(name = "rel_type") String relType) {
        return relationshipGraph.deleteRelationship(indexName, sourceDocId, targetDocId, relType)
            .thenApply(done -> ResponseEntity.noContent().build());
    }

    /**
     * GET /api/indexes/{indexName}/analytics
     */
    @GetMapping("/analytics")
    public CompletableFuture<AnalyticsResponse> analytics(@PathVariable String indexName) {
        return relationshipGraph.analytics(indexName).thenApply(AnalyticsResponse::from);
    }
}
