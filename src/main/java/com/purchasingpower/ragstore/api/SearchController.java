package com.purchasingpower.ragstore.api;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.search.SearchQuery;
import com.purchasingpower.ragstore.search.SearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * REST controller for ranked retrieval.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

    private final SearchService searchService;
    private final AppProperties props;

    /**
     * Search one index.
     *
     * POST /api/search
     */
    @PostMapping("/search")
    public CompletableFuture<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
        int topK = request.getTopK() != null ? request.getTopK() : props.getSearch().getDefaultTopK();
        log.info("Search: index={}, query='{}', topK={}", request.getIndexName(), request.getQuery(), topK);

        SearchQuery query = SearchQuery.builder()
            .indexName(request.getIndexName())
            .query(request.getQuery())
            .keywords(request.getKeywords())
            .topK(topK)
            .embedding(request.getEmbedding())
            .timeoutMs(request.getTimeoutMs())
            .build();
        return searchService.search(query).thenApply(SearchResponse::from);
    }
}
