package com.purchasingpower.ragstore.embedding.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.ragstore.configuration.AppProperties;
import com.purchasingpower.ragstore.configuration.EmbeddingProperties;
import com.purchasingpower.ragstore.configuration.RetryProperties;
import com.purchasingpower.ragstore.embedding.EmbeddingProvider;
import com.purchasingpower.ragstore.exception.UpstreamException;
import com.purchasingpower.ragstore.exception.UpstreamTimeoutException;
import com.purchasingpower.ragstore.model.CallContext;
import com.purchasingpower.ragstore.model.ServiceType;
import com.purchasingpower.ragstore.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Client for OpenAI-compatible {@code POST /embeddings} endpoints.
 *
 * <p>Request: {@code {"model": ..., "input": text}}; the vector is read from
 * {@code data[0].embedding}. Each attempt is bounded by
 * {@code app.embedding.request-timeout-ms}; timeouts, connection errors, 429
 * and 5xx answers are retried with exponential backoff ({@code app.retry.*}).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.embedding", name = "provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProperties settings;
    private final RetryProperties retry;
    private final WebClient webClient;

    @Autowired
    public OpenAiEmbeddingProvider(AppProperties props, RetryProperties retry, WebClient.Builder webClientBuilder) {
        this(props.getEmbedding(), retry, configure(webClientBuilder, props.getEmbedding()));
    }

    OpenAiEmbeddingProvider(EmbeddingProperties settings, RetryProperties retry, WebClient webClient) {
        this.settings = settings;
        this.retry = retry;
        this.webClient = webClient;
    }

    private static WebClient configure(WebClient.Builder builder, EmbeddingProperties settings) {
        String baseUrl = settings.getBaseUrl() != null ? settings.getBaseUrl().replaceAll("/+$", "") : "";
        builder.baseUrl(baseUrl);
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey());
        }
        return builder.build();
    }

    @Override
    public List<Double> embed(String text) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "embed", log);
        ctx.logRequest(ExternalCallLogger.truncate(text, 80), "model", settings.getModel());

        try {
            JsonNode response = webClient.post()
                .uri("/embeddings")
                .bodyValue(Map.of("model", settings.getModel(), "input", text))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(settings.getRequestTimeoutMs()))
                .retryWhen(buildRetrySpec())
                .block();

            List<Double> vector = parseEmbedding(response);
            ctx.logResponse(vector.size() + " dimensions");
            return vector;

        } catch (UpstreamTimeoutException | UpstreamException e) {
            ctx.logError(e.getMessage(), e.getCause());
            throw e;
        } catch (WebClientResponseException e) {
            ctx.logError("HTTP " + e.getStatusCode().value(), e);
            throw new UpstreamException("Embedding endpoint returned HTTP " + e.getStatusCode().value()
                + ": " + ExternalCallLogger.truncate(e.getResponseBodyAsString(), 200), e);
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new UpstreamException("Embedding call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return settings.getDimension();
    }

    /**
     * Exponential backoff over transient failures. When every attempt has
     * failed the call surfaces as {@link UpstreamTimeoutException}.
     */
    private Retry buildRetrySpec() {
        return Retry.backoff(Math.max(0, retry.getMaxAttempts() - 1), Duration.ofMillis(retry.getBackoffMs()))
            .maxBackoff(Duration.ofMillis(retry.getMaxBackoffMs()))
            .filter(this::isRetryable)
            .doBeforeRetry(signal -> log.warn("🔁 Embedding retry #{} after: {}",
                signal.totalRetries() + 1, signal.failure().toString()))
            .onRetryExhaustedThrow((spec, signal) -> new UpstreamTimeoutException(
                "Embedding endpoint did not succeed after " + (signal.totalRetries() + 1) + " attempts",
                signal.failure()));
    }

    private boolean isRetryable(Throwable ex) {
        if (ex instanceof TimeoutException || ex instanceof WebClientRequestException) {
            return true;
        }
        if (ex instanceof WebClientResponseException webEx) {
            int status = webEx.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    private List<Double> parseEmbedding(JsonNode response) {
        JsonNode embedding = response == null ? null : response.path("data").path(0).path("embedding");
        if (embedding == null || !embedding.isArray()) {
            throw new UpstreamException("Embedding response missing data[0].embedding");
        }
        List<Double> vector = new ArrayList<>(embedding.size());
        for (JsonNode value : embedding) {
            vector.add(value.asDouble());
        }
        return vector;
    }
}
