package com.rolefit.matcher.semantic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedding provider for OpenAI-compatible {@code POST /embeddings} endpoints.
 *
 * <p>Texts are sent in as few requests as the batch size allows. Response items are placed
 * by their {@code index} field, so the returned list always follows input order.
 * Any transport failure, non-2xx status or malformed body raises {@link ProviderException};
 * retries are left to the HTTP client configuration.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final int batchSize;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiEmbeddingProvider(String baseUrl, String model, String apiKey, int batchSize,
                                   OkHttpClient httpClient, ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model cannot be empty");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.model = model;
        this.apiKey = apiKey;
        this.batchSize = batchSize;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null) {
            throw new IllegalArgumentException("Texts cannot be null");
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
            vectors.addAll(embedBatch(batch));
        }
        log.debug("Embedded {} texts with model {}", texts.size(), model);
        return vectors;
    }

    private List<float[]> embedBatch(List<String> batch) {
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("model", model);
            ArrayNode input = payload.putArray("input");
            batch.forEach(input::add);
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ProviderException("Failed to encode embedding request", e);
        }

        Request.Builder request = new Request.Builder()
            .url(baseUrl + "/embeddings")
            .post(RequestBody.create(body, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                log.warn("Embedding request failed: HTTP {}", response.code());
                throw new ProviderException("Embedding request failed: HTTP " + response.code());
            }
            return parse(responseBody.string(), batch.size());
        } catch (IOException e) {
            log.error("Embedding request error: {}", e.getMessage());
            throw new ProviderException("Embedding request error: " + e.getMessage(), e);
        }
    }

    private List<float[]> parse(String json, int expected) throws IOException {
        JsonNode data = objectMapper.readTree(json).path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new ProviderException("Expected " + expected + " embeddings, got "
                + (data.isArray() ? data.size() : 0));
        }

        float[][] ordered = new float[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.has("index") ? item.get("index").asInt() : i;
            JsonNode embedding = item.path("embedding");
            if (index < 0 || index >= expected || ordered[index] != null || !embedding.isArray()) {
                throw new ProviderException("Malformed embedding item at position " + i);
            }
            float[] vector = new float[embedding.size()];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = (float) embedding.get(j).asDouble();
            }
            ordered[index] = vector;
        }
        return List.of(ordered);
    }

    @Override
    public String getModel() {
        return model;
    }
}
