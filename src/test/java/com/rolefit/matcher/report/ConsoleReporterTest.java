package com.rolefit.matcher.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Chunk;
import com.rolefit.matcher.explain.Explanation;
import com.rolefit.matcher.rank.RankedCandidate;
import com.rolefit.matcher.rank.Ranking;
import com.rolefit.matcher.rank.RankingMetrics;
import com.rolefit.matcher.score.HybridScoreCombiner;
import com.rolefit.matcher.score.MatchEvidence;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.score.SubScores;
import com.rolefit.matcher.semantic.ChunkMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConsoleReporterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:30:00Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static MatchResult result() {
        MatchEvidence evidence = new MatchEvidence(
            List.of("python", "sql"),
            List.of("spark"),
            List.of("kafka", "docker"),
            List.of(new ChunkMatch(new Chunk(0, "Built \"reliable\" SQL\nreports", 0, 27), 0.41)));
        return MatchResult.of(new HybridScoreCombiner(ScoringConfig.defaults())
            .combine(new SubScores(0.3, 0.6, 0.5, 0.5), List.of(), evidence));
    }

    private static Ranking ranking() {
        RankingMetrics metrics = new RankingMetrics();
        metrics.recordLatency(1_500);
        metrics.recordLatency(2_500);
        metrics.recordSkipped();
        return new Ranking(List.of(
            new RankedCandidate(1, "alice.txt", result(), "Built reliable SQL reports"),
            new RankedCandidate(2, "bob, jr.txt", result(), "")), metrics);
    }

    @Nested
    class MatchResultTests {

        @Test
        void shouldPrintOneLineWhenQuiet() {
            new ConsoleReporter(out, true, CLOCK).printMatchResult("cand.txt", "role.txt", result(), Optional.empty());

            assertThat(output().strip()).isEqualTo("cand.txt vs role.txt: 0.5000 (MODERATE)");
        }

        @Test
        void shouldPrintFullReport() {
            // Given
            Explanation explanation = new Explanation("Decent fit.", List.of("SQL"), List.of("No Spark"),
                List.of("Learn Spark"), "template");

            // When
            new ConsoleReporter(out, false, CLOCK).printMatchResult("cand.txt", "role.txt", result(),
                Optional.of(explanation));

            // Then
            assertThat(output())
                .contains("Candidate Match Report")
                .contains("Generated:       2026-03-01 09:30:00")
                .contains("Composite Score: 50.0%  [MODERATE]")
                .contains("CROSS_DOMAIN_BONUS")
                .contains("Missing Required Skills (1): spark")
                .contains("[chunk 0, 0.4100] Built \"reliable\" SQL reports")
                .contains("Explanation (template):")
                .contains("  - Learn Spark");
        }
    }

    @Nested
    class CsvTests {

        @Test
        void shouldPrintHeaderAndRow() {
            new ConsoleReporter(out, false, CLOCK).printMatchResultCsv("cand.txt", "role.txt", result());

            List<String> lines = output().lines().toList();
            assertThat(lines).hasSize(2);
            assertThat(lines.get(0)).startsWith("candidate,role,composite,category,technical_skill");
            assertThat(lines.get(1)).isEqualTo(
                "cand.txt,role.txt,0.5000,MODERATE,0.3000,0.6000,0.5000,0.5000,python;sql,spark,kafka;docker");
        }

        @Test
        void shouldQuoteValuesContainingCommas() {
            new ConsoleReporter(out, false, CLOCK).printRankingCsv("role.txt", ranking());

            List<String> lines = output().lines().toList();
            assertThat(lines.get(0)).startsWith("rank,candidate,role,");
            assertThat(lines.get(1)).startsWith("1,alice.txt,role.txt,0.5000,");
            assertThat(lines.get(2)).startsWith("2,\"bob, jr.txt\",role.txt,");
        }
    }

    @Nested
    class JsonTests {

        @Test
        void shouldWriteValidMatchJson() throws Exception {
            // When
            new ConsoleReporter(out, false, CLOCK).printMatchResultJson("cand \"1\".txt", "role.txt", result(),
                Optional.of(new Explanation("Line one\nline two", List.of(), List.of(), List.of(), "chat")));

            // Then
            JsonNode json = objectMapper.readTree(output());
            assertThat(json.get("candidate").asText()).isEqualTo("cand \"1\".txt");
            assertThat(json.get("compositeScore").asDouble()).isCloseTo(0.5, within(1e-6));
            assertThat(json.get("subScores").get("education").asDouble()).isEqualTo(0.5);
            assertThat(json.get("adjustments").get(0).get("reason").asText()).isEqualTo("CROSS_DOMAIN_BONUS");
            assertThat(json.get("adjustments").get(0).get("target").asText()).isEqualTo("composite");
            assertThat(json.get("missingPreferredSkills")).hasSize(2);
            assertThat(json.get("explanation").get("summary").asText()).isEqualTo("Line one\nline two");
            assertThat(json.get("timestamp").asText()).isEqualTo("2026-03-01 09:30:00");
        }

        @Test
        void shouldWriteValidRankingJson() throws Exception {
            new ConsoleReporter(out, false, CLOCK).printRankingJson("role.txt", ranking());

            JsonNode json = objectMapper.readTree(output());
            assertThat(json.get("candidates")).hasSize(2);
            assertThat(json.get("candidates").get(1).get("candidate").asText()).isEqualTo("bob, jr.txt");
            assertThat(json.get("metrics").get("scored").asInt()).isEqualTo(2);
            assertThat(json.get("metrics").get("skipped").asInt()).isEqualTo(1);
        }
    }

    @Nested
    class RankingTests {

        @Test
        void shouldPrintNumberedLinesWhenQuiet() {
            new ConsoleReporter(out, true, CLOCK).printRanking("role.txt", ranking());

            assertThat(output().lines().toList()).containsExactly(
                "1. alice.txt: 0.5000 (MODERATE)",
                "2. bob, jr.txt: 0.5000 (MODERATE)");
        }

        @Test
        void shouldPrintTableWithMetrics() {
            new ConsoleReporter(out, false, CLOCK).printRanking("role.txt", ranking());

            assertThat(output())
                .contains("Candidate Ranking")
                .contains("Built reliable SQL reports")
                .contains("Scored:          2")
                .contains("Skipped:         1")
                .contains("Avg Latency:");
        }
    }
}
