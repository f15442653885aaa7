package com.rolefit.matcher.config;

import java.util.Map;

/**
 * Settings for the external embedding and explanation providers.
 */
public class ProviderConfig {

    private EmbeddingSettings embedding = new EmbeddingSettings();
    private ExplanationSettings explanation = new ExplanationSettings();

    public static class EmbeddingSettings {
        private String type = "hashing"; // hashing, openai
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "text-embedding-3-small";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int dimension = 384;
        private int batchSize = 96;
        private int timeoutSeconds = 30;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class ExplanationSettings {
        private String type = "template"; // template, chat, none
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String model = "llama-3.3-70b-versatile";
        private String apiKeyEnv = "GROQ_API_KEY";
        private double temperature = 0.3;
        private int maxTokens = 500;
        private int timeoutSeconds = 60;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    static ProviderConfig fromMap(Map<String, Object> data) {
        ProviderConfig config = new ProviderConfig();
        if (data == null || !data.containsKey("providers")) {
            return config;
        }
        Map<String, Object> providers = YamlValues.section(data, "providers", "");

        if (providers.containsKey("embedding")) {
            Map<String, Object> e = YamlValues.section(providers, "embedding", "providers");
            EmbeddingSettings s = config.embedding;
            if (e.containsKey("type")) {
                s.setType(YamlValues.string(e, "type", "providers.embedding"));
            }
            if (e.containsKey("baseUrl")) {
                s.setBaseUrl(YamlValues.string(e, "baseUrl", "providers.embedding"));
            }
            if (e.containsKey("model")) {
                s.setModel(YamlValues.string(e, "model", "providers.embedding"));
            }
            if (e.containsKey("apiKeyEnv")) {
                s.setApiKeyEnv(YamlValues.string(e, "apiKeyEnv", "providers.embedding"));
            }
            if (e.containsKey("dimension")) {
                s.setDimension(YamlValues.intValue(e, "dimension", "providers.embedding"));
            }
            if (e.containsKey("batchSize")) {
                s.setBatchSize(YamlValues.intValue(e, "batchSize", "providers.embedding"));
            }
            if (e.containsKey("timeoutSeconds")) {
                s.setTimeoutSeconds(YamlValues.intValue(e, "timeoutSeconds", "providers.embedding"));
            }
        }

        if (providers.containsKey("explanation")) {
            Map<String, Object> x = YamlValues.section(providers, "explanation", "providers");
            ExplanationSettings s = config.explanation;
            if (x.containsKey("type")) {
                s.setType(YamlValues.string(x, "type", "providers.explanation"));
            }
            if (x.containsKey("baseUrl")) {
                s.setBaseUrl(YamlValues.string(x, "baseUrl", "providers.explanation"));
            }
            if (x.containsKey("model")) {
                s.setModel(YamlValues.string(x, "model", "providers.explanation"));
            }
            if (x.containsKey("apiKeyEnv")) {
                s.setApiKeyEnv(YamlValues.string(x, "apiKeyEnv", "providers.explanation"));
            }
            if (x.containsKey("temperature")) {
                s.setTemperature(YamlValues.doubleValue(x, "temperature", "providers.explanation"));
            }
            if (x.containsKey("maxTokens")) {
                s.setMaxTokens(YamlValues.intValue(x, "maxTokens", "providers.explanation"));
            }
            if (x.containsKey("timeoutSeconds")) {
                s.setTimeoutSeconds(YamlValues.intValue(x, "timeoutSeconds", "providers.explanation"));
            }
        }
        return config;
    }

    public EmbeddingSettings getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingSettings embedding) {
        this.embedding = embedding;
    }

    public ExplanationSettings getExplanation() {
        return explanation;
    }

    public void setExplanation(ExplanationSettings explanation) {
        this.explanation = explanation;
    }
}
