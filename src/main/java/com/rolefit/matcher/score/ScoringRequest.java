package com.rolefit.matcher.score;

import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Chunk;
import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.skill.SkillVocabulary;

import java.util.ArrayList;
import java.util.List;

/**
 * A validated, chunked document pair waiting for its vectors.
 *
 * <p>{@link #getTexts()} lists candidate chunk texts followed by role chunk texts; the
 * vectors handed back to {@link HybridMatchingEngine#complete} must follow that order.
 */
public final class ScoringRequest {

    private final Document candidate;
    private final Document role;
    private final ScoringConfig config;
    private final SkillVocabulary vocabulary;
    private final List<Chunk> candidateChunks;
    private final List<Chunk> roleChunks;

    ScoringRequest(Document candidate, Document role, ScoringConfig config, SkillVocabulary vocabulary,
                   List<Chunk> candidateChunks, List<Chunk> roleChunks) {
        this.candidate = candidate;
        this.role = role;
        this.config = config;
        this.vocabulary = vocabulary;
        this.candidateChunks = List.copyOf(candidateChunks);
        this.roleChunks = List.copyOf(roleChunks);
    }

    public List<String> getTexts() {
        List<String> texts = new ArrayList<>(candidateChunks.size() + roleChunks.size());
        candidateChunks.forEach(c -> texts.add(c.text()));
        roleChunks.forEach(c -> texts.add(c.text()));
        return texts;
    }

    public int getExpectedVectorCount() {
        return candidateChunks.size() + roleChunks.size();
    }

    public Document getCandidate() {
        return candidate;
    }

    public Document getRole() {
        return role;
    }

    public ScoringConfig getConfig() {
        return config;
    }

    public SkillVocabulary getVocabulary() {
        return vocabulary;
    }

    public List<Chunk> getCandidateChunks() {
        return candidateChunks;
    }

    public List<Chunk> getRoleChunks() {
        return roleChunks;
    }
}
