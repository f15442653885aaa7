package com.rolefit.matcher.explain;

import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Chunk;
import com.rolefit.matcher.score.Adjustment;
import com.rolefit.matcher.score.AdjustmentReason;
import com.rolefit.matcher.score.HybridScoreCombiner;
import com.rolefit.matcher.score.MatchEvidence;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.score.SubScores;
import com.rolefit.matcher.semantic.ChunkMatch;

import java.util.List;

/**
 * Ready-made match results for explanation tests.
 */
final class ExplanationFixtures {

    static final String ROLE_TEXT = "Senior Data Engineer\nRequired: Python, SQL, Spark, AWS";

    private ExplanationFixtures() {
    }

    static MatchResult strongMatch() {
        MatchEvidence evidence = new MatchEvidence(
            List.of("airflow", "aws", "docker", "python", "spark", "sql"),
            List.of(),
            List.of("kafka"),
            List.of(new ChunkMatch(new Chunk(0, "Built Spark pipelines in Python on AWS", 0, 38), 0.62)));
        return MatchResult.of(new HybridScoreCombiner(ScoringConfig.defaults())
            .combine(new SubScores(0.93, 1.0, 1.0, 1.0), List.of(), evidence));
    }

    static MatchResult weakMatch() {
        MatchEvidence evidence = new MatchEvidence(
            List.of(),
            List.of("aws", "python", "spark", "sql"),
            List.of("docker"),
            List.of(new ChunkMatch(new Chunk(0, "Designed numerical experiments", 0, 30), 0.31)));
        List<Adjustment> upstream = List.of(
            new Adjustment(AdjustmentReason.MISSING_SKILL_PENALTY, -0.15, "4 required skills missing"));
        return MatchResult.of(new HybridScoreCombiner(ScoringConfig.defaults())
            .combine(new SubScores(0.0, 0.56, 0.4, 0.5), upstream, evidence));
    }
}
