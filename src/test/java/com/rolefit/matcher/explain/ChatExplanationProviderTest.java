package com.rolefit.matcher.explain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rolefit.matcher.semantic.ProviderException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatExplanationProviderTest {

    private static final String ANSWER = """
        EXPLANATION:
        The candidate covers every required skill.
        Streaming experience is thinner than the role wants.

        STRENGTHS:
        - Hands-on Spark and Airflow
        - Six years in data engineering
        - Cloud delivery on AWS
        - Extra strength beyond the limit

        GAPS:
        - No Kafka
        - No Kubernetes
        - Third gap beyond the limit

        SUGGESTIONS:
        • Mention any event streaming work
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ChatExplanationProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = new ChatExplanationProvider(server.url("/openai/v1").toString(), "chat-model", "token",
            0.3, 500, new OkHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String completion(String content) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode message = root.putArray("choices").addObject().putObject("message");
        message.put("role", "assistant");
        message.put("content", content);
        return objectMapper.writeValueAsString(root);
    }

    private ExplanationRequest request() {
        return ExplanationRequest.from(ExplanationFixtures.strongMatch(), ExplanationFixtures.ROLE_TEXT);
    }

    @Nested
    class HttpTests {

        @Test
        void shouldPostChatCompletionRequest() throws Exception {
            // Given
            server.enqueue(new MockResponse().setResponseCode(200).setBody(completion(ANSWER)));

            // When
            provider.explain(request());

            // Then
            RecordedRequest recorded = server.takeRequest();
            assertThat(recorded.getPath()).isEqualTo("/openai/v1/chat/completions");
            assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer token");

            JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
            assertThat(body.get("model").asText()).isEqualTo("chat-model");
            assertThat(body.get("max_tokens").asInt()).isEqualTo(500);
            assertThat(body.get("messages").get(0).get("role").asText()).isEqualTo("user");
            assertThat(body.get("messages").get(0).get("content").asText())
                .contains("Overall Score: 97.2%")
                .contains("Built Spark pipelines in Python on AWS");
        }

        @Test
        void shouldParseSectionsWithLimits() throws Exception {
            // Given
            server.enqueue(new MockResponse().setResponseCode(200).setBody(completion(ANSWER)));

            // When
            Explanation explanation = provider.explain(request());

            // Then
            assertThat(explanation.source()).isEqualTo("chat");
            assertThat(explanation.summary()).isEqualTo(
                "The candidate covers every required skill. Streaming experience is thinner than the role wants.");
            assertThat(explanation.strengths()).hasSize(3).startsWith("Hands-on Spark and Airflow");
            assertThat(explanation.gaps()).containsExactly("No Kafka", "No Kubernetes");
            assertThat(explanation.suggestions()).containsExactly("Mention any event streaming work");
        }

        @Test
        void shouldFailOnErrorStatus() {
            server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"rate limited\"}"));

            assertThatThrownBy(() -> provider.explain(request()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("429");
        }

        @Test
        void shouldFailWithoutMessageContent() {
            server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"choices\":[]}"));

            assertThatThrownBy(() -> provider.explain(request()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("no message content");
        }
    }

    @Nested
    class PromptTests {

        @Test
        void shouldTruncateLongRoleText() {
            ExplanationRequest request = ExplanationRequest.from(ExplanationFixtures.strongMatch(),
                "x".repeat(1500));

            String prompt = provider.buildPrompt(request);

            assertThat(prompt).contains("x".repeat(1000)).doesNotContain("x".repeat(1001));
        }

        @Test
        void shouldListMissingSkills() {
            ExplanationRequest request = ExplanationRequest.from(ExplanationFixtures.strongMatch(), "role");

            assertThat(provider.buildPrompt(request)).contains("- Missing Skills: kafka");
        }
    }

    @Test
    void shouldUseRawTextWhenNoSectionsFound() {
        Explanation explanation = provider.parse("Looks like a reasonable fit overall.");

        assertThat(explanation.summary()).isEqualTo("Looks like a reasonable fit overall.");
        assertThat(explanation.strengths()).isEmpty();
    }
}
