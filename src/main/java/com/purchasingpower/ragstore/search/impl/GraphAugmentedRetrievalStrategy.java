package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.model.RelationshipEdge;
import com.purchasingpower.ragstore.model.SearchMode;
import com.purchasingpower.ragstore.search.RankedChunk;
import com.purchasingpower.ragstore.search.RetrievalRequest;
import com.purchasingpower.ragstore.search.RetrievalStrategy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hybrid ranking widened by one hop over the relationship graph.
 *
 * <p>Each of the top hybrid hits lends {@code score * decay} to the chunks it
 * is linked with (in either direction). A neighbour keeps the higher of its
 * own hybrid score and the best score lent to it.
 */
@Component
public class GraphAugmentedRetrievalStrategy implements RetrievalStrategy {

    private final HybridRetrievalStrategy hybrid;
    private final double decay;

    @Autowired
    public GraphAugmentedRetrievalStrategy(HybridRetrievalStrategy hybrid, AppProperties props) {
        this(hybrid, props.getSearch().getGraphNeighbourDecay());
    }

    public GraphAugmentedRetrievalStrategy(HybridRetrievalStrategy hybrid, double decay) {
        this.hybrid = hybrid;
        this.decay = decay;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.GRAPH;
    }

    @Override
    public List<RankedChunk> rank(RetrievalRequest request) {
        List<RankedChunk> all = hybrid.scoreAll(request);
        int topK = request.getTopK();

        Map<String, RankedChunk> byId = new LinkedHashMap<>();
        for (RankedChunk ranked : all) {
            byId.put(ranked.getChunk().getDocId(), ranked);
        }
        Map<String, Set<String>> neighbours = adjacency(request.getSnapshot().getRelationships());

        Map<String, Double> boosted = new HashMap<>();
        for (RankedChunk hit : all.subList(0, Math.min(topK, all.size()))) {
            double lent = hit.getScore() * decay;
            for (String neighbourId : neighbours.getOrDefault(hit.getChunk().getDocId(), Set.of())) {
                if (byId.containsKey(neighbourId)) {
                    boosted.merge(neighbourId, lent, Math::max);
                }
            }
        }

        List<RankedChunk> merged = new ArrayList<>(byId.size());
        for (RankedChunk ranked : byId.values()) {
            Double lent = boosted.get(ranked.getChunk().getDocId());
            if (lent != null && lent > ranked.getScore()) {
                merged.add(new RankedChunk(ranked.getChunk(), lent));
            } else {
                merged.add(ranked);
            }
        }
        merged.sort(RankedChunk.BY_RELEVANCE);
        return new ArrayList<>(merged.subList(0, Math.min(topK, merged.size())));
    }

    private static Map<String, Set<String>> adjacency(List<RelationshipEdge> edges) {
        Map<String, Set<String>> adjacency = new HashMap<>();
        if (edges == null) {
            return adjacency;
        }
        for (RelationshipEdge edge : edges) {
            adjacency.computeIfAbsent(edge.getSourceDocId(), id -> new HashSet<>()).add(edge.getTargetDocId());
            adjacency.computeIfAbsent(edge.getTargetDocId(), id -> new HashSet<>()).add(edge.getSourceDocId());
        }
        return adjacency;
    }
}
