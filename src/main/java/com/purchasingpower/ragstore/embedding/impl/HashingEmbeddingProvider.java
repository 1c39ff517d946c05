package com.purchasingpower.ragstore.embedding.impl;

import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.embedding.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Offline provider based on the feature-hashing trick.
 *
 * <p>Each lower-cased token is hashed into one bucket with a signed weight and
 * the vector is L2-normalized. Texts sharing tokens get a positive cosine
 * similarity, identical texts get identical vectors, and no network is used.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.embedding", name = "provider", havingValue = "hashing")
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    @Autowired
    public HashingEmbeddingProvider(AppProperties props) {
        this(props.getEmbedding().getDimension());
    }

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
        log.info("🔵 Hashing embedding provider ready (dimension={})", dimension);
    }

    @Override
    public List<Double> embed(String text) {
        double[] buckets = new double[dimension];
        for (String token : tokenize(text)) {
            long hash = hash(token);
            int bucket = (int) Math.floorMod(hash, (long) dimension);
            buckets[bucket] += (hash & 0x100000000L) == 0 ? 1.0 : -1.0;
        }

        double norm = 0.0;
        for (double value : buckets) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        List<Double> vector = new ArrayList<>(dimension);
        for (double value : buckets) {
            vector.add(norm == 0.0 ? 0.0 : value / norm);
        }
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static long hash(String token) {
        CRC32 crc = new CRC32();
        crc.update(token.getBytes(StandardCharsets.UTF_8));
        long low = crc.getValue();
        crc.update(0x5f);
        return low | (crc.getValue() << 32);
    }
}
