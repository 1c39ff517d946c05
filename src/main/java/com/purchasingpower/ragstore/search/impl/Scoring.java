package com.purchasingpower.ragstore.search.impl;

import com.purchasingpower.ragstore.model.DocumentChunk;
import com.purchasingpower.ragstore.model.metadata.MetadataValue;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scoring primitives shared by the retrieval strategies.
 */
public final class Scoring {

    private Scoring() {
    }

    /**
     * Cosine similarity; 0 when either vector is missing, empty, of a
     * different length, or all zeros.
     */
    public static double cosine(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Fraction of {@code terms} found, case-insensitively, in the chunk
     * content or in any scalar metadata value.
     */
    public static double keywordScore(List<String> terms, DocumentChunk chunk) {
        if (terms == null || terms.isEmpty()) {
            return 0.0;
        }
        String haystack = ((chunk.getContent() != null ? chunk.getContent() : "")
            + " " + MetadataValue.textOf(chunk.getMetadata())).toLowerCase(Locale.ROOT);
        int hits = 0;
        for (String term : terms) {
            if (haystack.contains(term)) {
                hits++;
            }
        }
        return (double) hits / terms.size();
    }

    /**
     * Keyword terms for a query: the explicit keywords when any are given,
     * otherwise the query's word tokens. Lower-cased and de-duplicated.
     */
    public static List<String> terms(String query, List<String> keywords) {
        Set<String> terms = new LinkedHashSet<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    terms.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        if (terms.isEmpty() && query != null) {
            for (String token : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
                if (!token.isEmpty()) {
                    terms.add(token);
                }
            }
        }
        return new ArrayList<>(terms);
    }

    /**
     * Min-max normalization into [0, 1]. A constant signal maps to 1 when it
     * is positive and to 0 otherwise.
     */
    public static double[] normalize(double[] values) {
        double[] normalized = new double[values.length];
        if (values.length == 0) {
            return normalized;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            if (range == 0.0) {
                normalized[i] = max > 0.0 ? 1.0 : 0.0;
            } else {
                normalized[i] = (values[i] - min) / range;
            }
        }
        return normalized;
    }
}
