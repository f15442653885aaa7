package com.rolefit.matcher.explain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolefit.matcher.config.ConfigException;
import com.rolefit.matcher.config.ProviderConfig;
import okhttp3.OkHttpClient;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Builds the explanation service selected in configuration.
 */
public final class ExplanationProviders {

    private ExplanationProviders() {
    }

    public static ExplanationService createService(ProviderConfig.ExplanationSettings settings) {
        return createService(settings, System::getenv);
    }

    /**
     * {@code none} disables explanations, {@code template} is offline only, {@code chat}
     * calls the chat endpoint and falls back to the template on failure.
     */
    static ExplanationService createService(ProviderConfig.ExplanationSettings settings,
                                            Function<String, String> env) {
        String type = settings.getType() == null ? "template" : settings.getType().toLowerCase(Locale.ROOT);
        TemplateExplanationProvider template = new TemplateExplanationProvider();
        return switch (type) {
            case "none" -> new ExplanationService(null, null);
            case "template" -> new ExplanationService(template, null);
            case "chat" -> new ExplanationService(createChat(settings, env), template);
            default -> throw new ConfigException("Unknown explanation provider type: " + settings.getType());
        };
    }

    private static ChatExplanationProvider createChat(ProviderConfig.ExplanationSettings settings,
                                                      Function<String, String> env) {
        String apiKey = settings.getApiKeyEnv() != null ? env.apply(settings.getApiKeyEnv()) : null;
        OkHttpClient client = new OkHttpClient.Builder()
            .callTimeout(settings.getTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(settings.getTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
        return new ChatExplanationProvider(settings.getBaseUrl(), settings.getModel(), apiKey,
            settings.getTemperature(), settings.getMaxTokens(), client, new ObjectMapper());
    }
}
