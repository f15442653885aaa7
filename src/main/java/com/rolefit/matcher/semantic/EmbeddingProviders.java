package com.rolefit.matcher.semantic;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolefit.matcher.config.ConfigException;
import com.rolefit.matcher.config.ProviderConfig;
import okhttp3.OkHttpClient;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Builds the embedding provider selected in configuration.
 */
public final class EmbeddingProviders {

    private EmbeddingProviders() {
    }

    public static EmbeddingProvider create(ProviderConfig.EmbeddingSettings settings) {
        return create(settings, System::getenv);
    }

    static EmbeddingProvider create(ProviderConfig.EmbeddingSettings settings, Function<String, String> env) {
        String type = settings.getType() == null ? "hashing" : settings.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "hashing" -> new HashingEmbeddingProvider(settings.getDimension());
            case "openai" -> {
                String apiKey = settings.getApiKeyEnv() != null ? env.apply(settings.getApiKeyEnv()) : null;
                OkHttpClient client = new OkHttpClient.Builder()
                    .callTimeout(settings.getTimeoutSeconds(), TimeUnit.SECONDS)
                    .readTimeout(settings.getTimeoutSeconds(), TimeUnit.SECONDS)
                    .build();
                yield new OpenAiEmbeddingProvider(settings.getBaseUrl(), settings.getModel(), apiKey,
                    settings.getBatchSize(), client, new ObjectMapper());
            }
            default -> throw new ConfigException("Unknown embedding provider type: " + settings.getType());
        };
    }
}
