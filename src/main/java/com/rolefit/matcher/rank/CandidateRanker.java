package com.rolefit.matcher.rank;

import com.rolefit.matcher.MatchingException;
import com.rolefit.matcher.config.ConfigException;
import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.document.DocumentRole;
import com.rolefit.matcher.document.EmptyInputException;
import com.rolefit.matcher.score.HybridMatchingEngine;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.semantic.ChunkMatch;
import com.rolefit.matcher.skill.SkillVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores many candidates against one role and orders them.
 *
 * <p>Candidates are sorted by composite score, highest first; equal scores keep their input
 * order. A candidate that cannot be scored (blank text, provider failure) is logged and
 * left out. Configuration errors and a blank role abort the whole run.
 */
public class CandidateRanker {

    private static final Logger log = LoggerFactory.getLogger(CandidateRanker.class);

    static final int MATCH_REASON_LENGTH = 200;

    private final HybridMatchingEngine engine;

    public CandidateRanker(HybridMatchingEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("Engine cannot be null");
        }
        this.engine = engine;
    }

    public Ranking rank(List<CandidateEntry> candidates, Document role, ScoringConfig config,
                        SkillVocabulary vocabulary, int topN) {
        if (candidates == null) {
            throw new IllegalArgumentException("Candidates cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be at least 1, got " + topN);
        }
        config.validate();
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (role.isBlank()) {
            throw new EmptyInputException(DocumentRole.TARGET_ROLE);
        }

        RankingMetrics metrics = new RankingMetrics();
        List<Scored> scored = new ArrayList<>();

        for (int i = 0; i < candidates.size(); i++) {
            CandidateEntry entry = candidates.get(i);
            long start = System.nanoTime();
            try {
                MatchResult result = engine.score(entry.document(), role, config, vocabulary);
                metrics.recordLatency((System.nanoTime() - start) / 1000);
                scored.add(new Scored(i, entry.id(), result));
                log.debug("Scored candidate '{}': {}", entry.id(), result.compositeScore());
            } catch (ConfigException e) {
                throw e;
            } catch (MatchingException e) {
                metrics.recordSkipped();
                log.warn("Skipping candidate '{}': {}", entry.id(), e.getMessage());
            }
        }

        scored.sort(Comparator.comparingDouble((Scored s) -> s.result().compositeScore()).reversed()
            .thenComparingInt(Scored::inputIndex));

        List<RankedCandidate> ranked = new ArrayList<>();
        for (int i = 0; i < Math.min(topN, scored.size()); i++) {
            Scored s = scored.get(i);
            ranked.add(new RankedCandidate(i + 1, s.id(), s.result(), matchReason(s.result())));
        }

        log.info("Ranked {} of {} candidates ({} skipped)", scored.size(), candidates.size(), metrics.getSkipped());
        return new Ranking(ranked, metrics);
    }

    static String matchReason(MatchResult result) {
        List<ChunkMatch> top = result.breakdown().getEvidence().topMatches();
        if (top.isEmpty()) {
            return "";
        }
        String text = top.get(0).chunk().text();
        return text.length() <= MATCH_REASON_LENGTH ? text : text.substring(0, MATCH_REASON_LENGTH);
    }

    private record Scored(int inputIndex, String id, MatchResult result) {}
}
