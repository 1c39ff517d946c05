package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Embedding provider settings ({@code app.embedding}).
 *
 * <p>{@code OPENAI} talks to any OpenAI-compatible {@code /embeddings} endpoint;
 * {@code HASHING} computes deterministic feature-hashing vectors locally and
 * needs no network.
 */
@Data
public class EmbeddingProperties {

    public enum Provider {
        OPENAI,
        HASHING
    }

    @NotNull
    private Provider provider = Provider.OPENAI;

    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey;

    private String model = "text-embedding-3-small";

    /**
     * Length of the vectors the model produces.
     */
    @Min(1)
    private int dimension = 1536;

    /**
     * Per-attempt timeout for one embedding request.
     */
    @Min(1)
    private long requestTimeoutMs = 30_000;

    /**
     * Maximum number of embedding calls in flight at once.
     */
    @Min(1)
    private int maxConcurrency = 4;
}
