package com.purchasingpower.ragstore.util;

import com.purchasingpower.ragstore.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Checks on caller-supplied embeddings.
 */
@Slf4j
public final class EmbeddingVectors {

    private EmbeddingVectors() {
    }

    /**
     * Rejects null and non-finite components. A null list passes; it means
     * the embedding was not supplied.
     *
     * @throws ValidationException naming the field and the first bad position
     */
    public static void requireFinite(String field, List<Double> embedding) {
        if (embedding == null) {
            return;
        }
        for (int i = 0; i < embedding.size(); i++) {
            Double value = embedding.get(i);
            if (value == null || !Double.isFinite(value)) {
                log.warn("⚠️ Rejected {} with component {} = {}", field, i, value);
                throw new ValidationException(field + "[" + i + "] must be a finite number, got " + value);
            }
        }
    }
}
