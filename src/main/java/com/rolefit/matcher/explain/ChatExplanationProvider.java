package com.rolefit.matcher.explain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rolefit.matcher.semantic.ProviderException;
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
 * Explanation provider backed by an OpenAI-compatible {@code POST /chat/completions} endpoint.
 *
 * <p>The model is asked for a fixed plain-text layout with EXPLANATION, STRENGTHS, GAPS and
 * SUGGESTIONS sections, which is parsed leniently. Unrecognized output falls back to the
 * first 200 characters of the reply as the summary.
 */
public class ChatExplanationProvider implements ExplanationProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatExplanationProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    public static final String NAME = "chat";

    static final int ROLE_TEXT_LIMIT = 1000;
    static final int PASSAGE_LIMIT = 3;
    static final int SKILL_LIMIT = 10;
    static final int MAX_STRENGTHS = 3;
    static final int MAX_GAPS = 2;
    static final int MAX_SUGGESTIONS = 3;
    static final int RAW_SUMMARY_LIMIT = 200;

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ChatExplanationProvider(String baseUrl, String model, String apiKey, double temperature, int maxTokens,
                                   OkHttpClient httpClient, ObjectMapper objectMapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model cannot be empty");
        }
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.model = model;
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Explanation explain(ExplanationRequest request) {
        String prompt = buildPrompt(request);
        String body;
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("model", model);
            payload.put("temperature", temperature);
            payload.put("max_tokens", maxTokens);
            ArrayNode messages = payload.putArray("messages");
            ObjectNode message = messages.addObject();
            message.put("role", "user");
            message.put("content", prompt);
            body = objectMapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new ProviderException("Failed to encode chat request", e);
        }

        Request.Builder httpRequest = new Request.Builder()
            .url(baseUrl + "/chat/completions")
            .post(RequestBody.create(body, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            httpRequest.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(httpRequest.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new ProviderException("Chat request failed: HTTP " + response.code());
            }
            JsonNode content = objectMapper.readTree(responseBody.string())
                .path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new ProviderException("Chat response has no message content");
            }
            log.debug("Chat explanation received from {}", model);
            return parse(content.asText());
        } catch (IOException e) {
            throw new ProviderException("Chat request error: " + e.getMessage(), e);
        }
    }

    String buildPrompt(ExplanationRequest request) {
        String roleText = request.roleText();
        if (roleText.length() > ROLE_TEXT_LIMIT) {
            roleText = roleText.substring(0, ROLE_TEXT_LIMIT);
        }
        List<String> passages = request.topPassages()
            .subList(0, Math.min(PASSAGE_LIMIT, request.topPassages().size()));
        String matched = request.matchedSkills().isEmpty() ? "None found"
            : String.join(", ", request.matchedSkills().subList(0, Math.min(SKILL_LIMIT, request.matchedSkills().size())));
        String missing = request.missingSkills().isEmpty() ? "None"
            : String.join(", ", request.missingSkills().subList(0, Math.min(SKILL_LIMIT, request.missingSkills().size())));

        return """
            You are an expert technical recruiter analyzing a resume-job match.

            JOB REQUIREMENTS:
            %s

            TOP MATCHING RESUME SECTIONS:
            %s

            MATCH DATA:
            - Overall Score: %.1f%%
            - Matched Skills: %s
            - Missing Skills: %s

            Provide a concise analysis in this EXACT format:

            EXPLANATION:
            [2-3 sentences explaining why this candidate matches or doesn't match]

            STRENGTHS:
            - [Key strength 1]
            - [Key strength 2]
            - [Key strength 3]

            GAPS:
            - [Gap 1]
            - [Gap 2]

            SUGGESTIONS:
            - [Actionable suggestion 1]
            - [Actionable suggestion 2]

            Keep it professional, specific, and actionable.
            """.formatted(roleText, String.join("\n\n---\n\n", passages),
                request.compositeScore() * 100, matched, missing);
    }

    Explanation parse(String raw) {
        StringBuilder summary = new StringBuilder();
        List<String> strengths = new ArrayList<>();
        List<String> gaps = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        String section = null;
        for (String rawLine : raw.split("\\R")) {
            String line = rawLine.strip();
            if (line.startsWith("EXPLANATION:")) {
                section = "explanation";
                summary.append(line.substring("EXPLANATION:".length()).strip());
            } else if (line.startsWith("STRENGTHS:")) {
                section = "strengths";
            } else if (line.startsWith("GAPS:")) {
                section = "gaps";
            } else if (line.startsWith("SUGGESTIONS:")) {
                section = "suggestions";
            } else if (line.startsWith("-") || line.startsWith("•")) {
                String item = line.replaceFirst("^[-•]+", "").strip();
                if ("strengths".equals(section)) {
                    strengths.add(item);
                } else if ("gaps".equals(section)) {
                    gaps.add(item);
                } else if ("suggestions".equals(section)) {
                    suggestions.add(item);
                }
            } else if ("explanation".equals(section) && !line.isEmpty()) {
                if (summary.length() > 0) {
                    summary.append(' ');
                }
                summary.append(line);
            }
        }

        String text = summary.length() > 0 ? summary.toString()
            : raw.substring(0, Math.min(RAW_SUMMARY_LIMIT, raw.length()));
        return new Explanation(text,
            head(strengths, MAX_STRENGTHS), head(gaps, MAX_GAPS), head(suggestions, MAX_SUGGESTIONS), NAME);
    }

    private static List<String> head(List<String> items, int n) {
        return items.subList(0, Math.min(n, items.size()));
    }

    @Override
    public String getName() {
        return NAME;
    }
}
