package com.rolefit.matcher.report;

import com.rolefit.matcher.explain.Explanation;
import com.rolefit.matcher.rank.RankedCandidate;
import com.rolefit.matcher.rank.Ranking;
import com.rolefit.matcher.rank.RankingMetrics;
import com.rolefit.matcher.score.Adjustment;
import com.rolefit.matcher.score.MatchEvidence;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.score.ScoreBreakdown;
import com.rolefit.matcher.score.SubScores;
import com.rolefit.matcher.semantic.ChunkMatch;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Console, CSV and JSON rendering of match results and rankings.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int PASSAGE_PREVIEW = 160;

    private final PrintStream out;
    private final boolean quiet;
    private final Clock clock;

    public ConsoleReporter(PrintStream out, boolean quiet) {
        this(out, quiet, Clock.systemDefaultZone());
    }

    public ConsoleReporter(PrintStream out, boolean quiet, Clock clock) {
        this.out = out;
        this.quiet = quiet;
        this.clock = clock;
    }

    public void printMatchResult(String candidateName, String roleName, MatchResult result,
                                 Optional<Explanation> explanation) {
        if (quiet) {
            out.printf("%s vs %s: %.4f (%s)%n", candidateName, roleName, result.compositeScore(), result.category());
            return;
        }

        ScoreBreakdown breakdown = result.breakdown();
        SubScores s = breakdown.getSubScores();
        MatchEvidence evidence = breakdown.getEvidence();

        out.println();
        out.println(SEPARATOR);
        out.println("                         Candidate Match Report");
        out.println(SEPARATOR);
        out.println();
        out.printf("Candidate:       %s%n", candidateName);
        out.printf("Role:            %s%n", roleName);
        out.printf("Generated:       %s%n", LocalDateTime.now(clock).format(DT_FORMAT));
        out.println();
        out.printf("Composite Score: %.1f%%  [%s]%n", result.compositeScore() * 100, result.category());
        out.printf("Recommendation:  %s%n", result.category().getRecommendation());
        out.println();
        out.printf("%-18s %10s %10s%n", "Component", "Score", "Weight");
        out.println(THIN_SEPARATOR);
        out.printf("%-18s %10.4f %10.2f%n", "Technical skill", s.technicalSkill(), breakdown.getWeights().getTechnicalSkill());
        out.printf("%-18s %10.4f %10.2f%n", "Semantic", s.semantic(), breakdown.getWeights().getSemantic());
        out.printf("%-18s %10.4f %10.2f%n", "Experience", s.experience(), breakdown.getWeights().getExperience());
        out.printf("%-18s %10.4f %10.2f%n", "Education", s.education(), breakdown.getWeights().getEducation());
        out.println(THIN_SEPARATOR);
        out.printf("%-18s %10.4f%n", "Base", breakdown.getBaseScore());

        if (!breakdown.getAdjustments().isEmpty()) {
            out.println();
            out.println("Adjustments:");
            for (Adjustment a : breakdown.getAdjustments()) {
                out.printf("  %-22s %+8.4f  (%s) %s%n",
                    a.reason(), a.delta(), a.target().getKey(), a.description());
            }
        }

        out.println();
        out.printf("Matched Skills (%d):          %s%n", evidence.matchedSkills().size(), joinOrNone(evidence.matchedSkills()));
        out.printf("Missing Required Skills (%d): %s%n", evidence.missingRequiredSkills().size(),
            joinOrNone(evidence.missingRequiredSkills()));
        out.printf("Missing Preferred Skills (%d): %s%n", evidence.missingPreferredSkills().size(),
            joinOrNone(evidence.missingPreferredSkills()));

        if (!evidence.topMatches().isEmpty()) {
            out.println();
            out.println("Top Matching Passages:");
            for (ChunkMatch m : evidence.topMatches()) {
                out.printf("  [chunk %d, %.4f] %s%n", m.chunk().index(), m.similarity(), preview(m.chunk().text()));
            }
        }

        explanation.ifPresent(this::printExplanation);
        out.println(SEPARATOR);
    }

    private void printExplanation(Explanation e) {
        out.println();
        out.printf("Explanation (%s):%n", e.source());
        out.printf("  %s%n", e.summary());
        printList("Strengths", e.strengths());
        printList("Gaps", e.gaps());
        printList("Suggestions", e.suggestions());
    }

    private void printList(String title, List<String> items) {
        if (items.isEmpty()) return;
        out.println();
        out.println(title + ":");
        for (String item : items) {
            out.printf("  - %s%n", item);
        }
    }

    public void printMatchResultCsv(String candidateName, String roleName, MatchResult result) {
        out.println("candidate,role,composite,category,technical_skill,semantic,experience,education,"
            + "matched_skills,missing_required,missing_preferred");
        printMatchRowCsv(candidateName, roleName, result);
    }

    private void printMatchRowCsv(String candidateName, String roleName, MatchResult result) {
        SubScores s = result.breakdown().getSubScores();
        MatchEvidence evidence = result.breakdown().getEvidence();
        out.printf("%s,%s,%.4f,%s,%.4f,%.4f,%.4f,%.4f,%s,%s,%s%n",
            csv(candidateName), csv(roleName), result.compositeScore(), result.category(),
            s.technicalSkill(), s.semantic(), s.experience(), s.education(),
            csv(String.join(";", evidence.matchedSkills())),
            csv(String.join(";", evidence.missingRequiredSkills())),
            csv(String.join(";", evidence.missingPreferredSkills())));
    }

    public void printMatchResultJson(String candidateName, String roleName, MatchResult result,
                                     Optional<Explanation> explanation) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        sb.append(String.format("  \"candidate\": \"%s\",\n", escape(candidateName)));
        sb.append(String.format("  \"role\": \"%s\",\n", escape(roleName)));
        appendResult(sb, result, "  ");
        explanation.ifPresent(e -> {
            sb.append(",\n  \"explanation\": {\n");
            sb.append(String.format("    \"source\": \"%s\",\n", escape(e.source())));
            sb.append(String.format("    \"summary\": \"%s\",\n", escape(e.summary())));
            sb.append(String.format("    \"strengths\": %s,\n", jsonArray(e.strengths())));
            sb.append(String.format("    \"gaps\": %s,\n", jsonArray(e.gaps())));
            sb.append(String.format("    \"suggestions\": %s\n", jsonArray(e.suggestions())));
            sb.append("  }");
        });
        sb.append(",\n");
        sb.append(String.format("  \"timestamp\": \"%s\"\n", LocalDateTime.now(clock).format(DT_FORMAT)));
        sb.append("}\n");
        out.print(sb);
    }

    private void appendResult(StringBuilder sb, MatchResult result, String indent) {
        ScoreBreakdown b = result.breakdown();
        SubScores s = b.getSubScores();
        MatchEvidence evidence = b.getEvidence();

        sb.append(String.format("%s\"compositeScore\": %.6f,\n", indent, result.compositeScore()));
        sb.append(String.format("%s\"category\": \"%s\",\n", indent, result.category()));
        sb.append(String.format("%s\"baseScore\": %.6f,\n", indent, b.getBaseScore()));
        sb.append(String.format("%s\"subScores\": {\"technical_skill\": %.6f, \"semantic\": %.6f, "
                + "\"experience\": %.6f, \"education\": %.6f},\n",
            indent, s.technicalSkill(), s.semantic(), s.experience(), s.education()));
        sb.append(indent).append("\"adjustments\": [");
        List<Adjustment> adjustments = b.getAdjustments();
        for (int i = 0; i < adjustments.size(); i++) {
            Adjustment a = adjustments.get(i);
            sb.append(String.format("{\"reason\": \"%s\", \"target\": \"%s\", \"delta\": %.6f, \"description\": \"%s\"}",
                a.reason(), a.target().getKey(), a.delta(), escape(a.description())));
            if (i < adjustments.size() - 1) {
                sb.append(", ");
            }
        }
        sb.append("],\n");
        sb.append(String.format("%s\"matchedSkills\": %s,\n", indent, jsonArray(evidence.matchedSkills())));
        sb.append(String.format("%s\"missingRequiredSkills\": %s,\n", indent, jsonArray(evidence.missingRequiredSkills())));
        sb.append(String.format("%s\"missingPreferredSkills\": %s", indent, jsonArray(evidence.missingPreferredSkills())));
    }

    public void printRanking(String roleName, Ranking ranking) {
        if (quiet) {
            for (RankedCandidate c : ranking.candidates()) {
                out.printf("%d. %s: %.4f (%s)%n", c.rank(), c.id(), c.compositeScore(), c.result().category());
            }
            return;
        }

        out.println();
        out.println(SEPARATOR);
        out.println("                           Candidate Ranking");
        out.println(SEPARATOR);
        out.println();
        out.printf("Role:            %s%n", roleName);
        out.printf("Generated:       %s%n", LocalDateTime.now(clock).format(DT_FORMAT));
        out.println();
        out.printf("%-5s %-30s %10s %-10s %8s %8s%n", "Rank", "Candidate", "Score", "Category", "Matched", "Missing");
        out.println(THIN_SEPARATOR);
        for (RankedCandidate c : ranking.candidates()) {
            MatchEvidence evidence = c.result().breakdown().getEvidence();
            out.printf("%-5d %-30s %9.1f%% %-10s %8d %8d%n",
                c.rank(), truncate(c.id(), 30), c.compositeScore() * 100, c.result().category(),
                evidence.matchedSkills().size(), evidence.missingRequiredSkills().size());
            if (!c.matchReason().isEmpty()) {
                out.printf("      %s%n", preview(c.matchReason()));
            }
        }
        out.println(THIN_SEPARATOR);

        RankingMetrics m = ranking.metrics();
        out.println();
        out.printf("Scored:          %d%n", m.getScored());
        if (m.getSkipped() > 0) {
            out.printf("Skipped:         %d%n", m.getSkipped());
        }
        out.printf("Avg Latency:     %.2f ms%n", m.getAvgLatencyMs());
        out.printf("P50 Latency:     %.2f ms%n", m.getP50LatencyMs());
        out.printf("P95 Latency:     %.2f ms%n", m.getP95LatencyMs());
        out.printf("Max Latency:     %.2f ms%n", m.getMaxLatencyMs());
        out.println(SEPARATOR);
    }

    public void printRankingCsv(String roleName, Ranking ranking) {
        out.println("rank,candidate,role,composite,category,technical_skill,semantic,experience,education,"
            + "matched_skills,missing_required,missing_preferred");
        for (RankedCandidate c : ranking.candidates()) {
            out.print(c.rank() + ",");
            printMatchRowCsv(c.id(), roleName, c.result());
        }
    }

    public void printRankingJson(String roleName, Ranking ranking) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        sb.append(String.format("  \"role\": \"%s\",\n", escape(roleName)));
        sb.append("  \"candidates\": [\n");
        List<RankedCandidate> candidates = ranking.candidates();
        for (int i = 0; i < candidates.size(); i++) {
            RankedCandidate c = candidates.get(i);
            sb.append("    {\n");
            sb.append(String.format("      \"rank\": %d,\n", c.rank()));
            sb.append(String.format("      \"candidate\": \"%s\",\n", escape(c.id())));
            sb.append(String.format("      \"matchReason\": \"%s\",\n", escape(c.matchReason())));
            appendResult(sb, c.result(), "      ");
            sb.append("\n    }");
            if (i < candidates.size() - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }
        sb.append("  ],\n");
        RankingMetrics m = ranking.metrics();
        sb.append(String.format("  \"metrics\": {\"scored\": %d, \"skipped\": %d, \"avgLatencyMs\": %.3f, "
                + "\"p50LatencyMs\": %.3f, \"p95LatencyMs\": %.3f, \"maxLatencyMs\": %.3f},\n",
            m.getScored(), m.getSkipped(), m.getAvgLatencyMs(), m.getP50LatencyMs(),
            m.getP95LatencyMs(), m.getMaxLatencyMs()));
        sb.append(String.format("  \"timestamp\": \"%s\"\n", LocalDateTime.now(clock).format(DT_FORMAT)));
        sb.append("}\n");
        out.print(sb);
    }

    private String jsonArray(List<String> items) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < items.size(); i++) {
            sb.append('"').append(escape(items.get(i))).append('"');
            if (i < items.size() - 1) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }

    private String escape(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
    }

    private String csv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String joinOrNone(List<String> items) {
        return items.isEmpty() ? "(none)" : String.join(", ", items);
    }

    private static String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").strip();
        return truncate(flat, PASSAGE_PREVIEW);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }
}
