package com.rolefit.matcher.score;

import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.Chunk;
import com.rolefit.matcher.document.Chunker;
import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.document.DocumentRole;
import com.rolefit.matcher.document.EmptyInputException;
import com.rolefit.matcher.match.EducationMatcher;
import com.rolefit.matcher.match.ExperienceMatcher;
import com.rolefit.matcher.semantic.AsyncEmbeddingProvider;
import com.rolefit.matcher.semantic.EmbeddingProvider;
import com.rolefit.matcher.semantic.ProviderException;
import com.rolefit.matcher.semantic.SemanticScore;
import com.rolefit.matcher.semantic.SemanticSimilarityScorer;
import com.rolefit.matcher.semantic.VectorMath;
import com.rolefit.matcher.skill.KeywordMatchResult;
import com.rolefit.matcher.skill.KeywordMatcher;
import com.rolefit.matcher.skill.SkillVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Scores a candidate document against a target-role document.
 *
 * <p>The engine holds no per-call state: configuration and vocabulary travel with each call,
 * and the collaborators it keeps are themselves stateless, so one instance may be shared
 * across threads. All chunks of both documents go to the embedding provider in one call.
 *
 * <p>Scoring can be split in two for callers that fetch vectors themselves:
 * {@link #prepare} validates and chunks, {@link #complete} finishes once vectors are in.
 */
public class HybridMatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(HybridMatchingEngine.class);

    private final EmbeddingProvider embeddingProvider;
    private final SkillVocabulary defaultVocabulary;
    private final Clock clock;
    private final KeywordMatcher keywordMatcher;
    private final SemanticSimilarityScorer semanticScorer;

    public HybridMatchingEngine(EmbeddingProvider embeddingProvider, SkillVocabulary defaultVocabulary) {
        this(embeddingProvider, defaultVocabulary, Clock.systemDefaultZone());
    }

    /**
     * @param embeddingProvider provider used by the blocking {@link #score} calls; may be null
     *                          when only {@link #prepare}/{@link #complete} are used
     * @param defaultVocabulary vocabulary for calls that do not pass one
     * @param clock             source of the current year for "present" in employment dates
     */
    public HybridMatchingEngine(EmbeddingProvider embeddingProvider, SkillVocabulary defaultVocabulary, Clock clock) {
        if (defaultVocabulary == null) {
            throw new IllegalArgumentException("Vocabulary cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.embeddingProvider = embeddingProvider;
        this.defaultVocabulary = defaultVocabulary;
        this.clock = clock;
        this.keywordMatcher = new KeywordMatcher();
        this.semanticScorer = new SemanticSimilarityScorer();
    }

    public MatchResult score(Document candidate, Document role, ScoringConfig config) {
        return score(candidate, role, config, defaultVocabulary);
    }

    /**
     * Score one pair, blocking on the embedding provider.
     *
     * @throws com.rolefit.matcher.config.ConfigException if {@code config} is invalid
     * @throws EmptyInputException if either document is blank
     * @throws ProviderException if the embeddings cannot be obtained
     */
    public MatchResult score(Document candidate, Document role, ScoringConfig config, SkillVocabulary vocabulary) {
        if (embeddingProvider == null) {
            throw new IllegalStateException("No embedding provider configured for blocking scoring");
        }
        ScoringRequest request = prepare(candidate, role, config, vocabulary);
        return complete(request, embed(request.getTexts()));
    }

    /**
     * Score one pair without blocking on the provider. Validation and input errors fail
     * the returned future rather than being thrown.
     */
    public CompletableFuture<MatchResult> scoreAsync(Document candidate, Document role, ScoringConfig config,
                                                     SkillVocabulary vocabulary, AsyncEmbeddingProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider cannot be null");
        }
        ScoringRequest request;
        try {
            request = prepare(candidate, role, config, vocabulary);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return provider.embedAsync(request.getTexts()).thenApply(vectors -> complete(request, vectors));
    }

    /**
     * Validate configuration and inputs, then chunk both documents.
     */
    public ScoringRequest prepare(Document candidate, Document role, ScoringConfig config, SkillVocabulary vocabulary) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        config.validate();
        if (candidate == null || role == null) {
            throw new IllegalArgumentException("Documents cannot be null");
        }
        if (vocabulary == null) {
            throw new IllegalArgumentException("Vocabulary cannot be null");
        }
        if (candidate.role() != DocumentRole.CANDIDATE) {
            throw new IllegalArgumentException("First document must be a candidate, got " + candidate.role());
        }
        if (role.role() != DocumentRole.TARGET_ROLE) {
            throw new IllegalArgumentException("Second document must be a target role, got " + role.role());
        }
        if (candidate.isBlank()) {
            throw new EmptyInputException(DocumentRole.CANDIDATE);
        }
        if (role.isBlank()) {
            throw new EmptyInputException(DocumentRole.TARGET_ROLE);
        }

        Chunker chunker = new Chunker(config.getChunkWindowWords(), config.getChunkOverlapWords());
        List<Chunk> candidateChunks = chunker.chunk(candidate.text());
        List<Chunk> roleChunks = chunker.chunk(role.text());
        log.debug("Prepared scoring request: candidateChunks={}, roleChunks={}",
                  candidateChunks.size(), roleChunks.size());
        return new ScoringRequest(candidate, role, config, vocabulary, candidateChunks, roleChunks);
    }

    /**
     * Finish scoring with vectors for {@link ScoringRequest#getTexts()}, in that order.
     *
     * @throws ProviderException if the vector count does not match the request or a vector
     *                           holds a missing, NaN or infinite component
     */
    public MatchResult complete(ScoringRequest request, List<float[]> vectors) {
        if (request == null) {
            throw new IllegalArgumentException("Request cannot be null");
        }
        if (vectors == null || vectors.size() != request.getExpectedVectorCount()) {
            throw new ProviderException("Embedding provider returned "
                + (vectors == null ? 0 : vectors.size()) + " vectors for "
                + request.getExpectedVectorCount() + " texts");
        }
        requireFinite(vectors);

        ScoringConfig config = request.getConfig();
        String candidateText = request.getCandidate().text();
        String roleText = request.getRole().text();
        int candidateCount = request.getCandidateChunks().size();

        SemanticScore semantic = semanticScorer.score(
            request.getCandidateChunks(),
            vectors.subList(0, candidateCount),
            vectors.subList(candidateCount, vectors.size()),
            config);

        KeywordMatchResult keywords = keywordMatcher.match(candidateText, roleText, request.getVocabulary(), config);

        double experience = new ExperienceMatcher(config.getExperienceMaxShortfallYears(), Year.now(clock))
            .score(candidateText, roleText);
        double education = new EducationMatcher(config.getEducationPartialCredit())
            .score(candidateText, roleText);

        SubScores subScores = new SubScores(
            VectorMath.clamp01(keywords.getKeywordScore()),
            semantic.score(),
            experience,
            education);

        List<Adjustment> upstream = new ArrayList<>();
        if (semantic.boostDelta() != 0.0) {
            upstream.add(new Adjustment(AdjustmentReason.SEMANTIC_BOOST, semantic.boostDelta(),
                String.format("Raw similarity %.4f x %.2f boost", semantic.rawSimilarity(), semantic.boostFactor())));
        }
        if (keywords.isPenaltyApplied()) {
            upstream.add(new Adjustment(AdjustmentReason.MISSING_SKILL_PENALTY, keywords.getPenalty(),
                keywords.getMissingRequired().size() + " required skills missing"));
        }

        MatchEvidence evidence = new MatchEvidence(
            List.copyOf(keywords.getMatched()),
            List.copyOf(keywords.getMissingRequired()),
            List.copyOf(keywords.getMissingPreferred()),
            semantic.topMatches());

        ScoreBreakdown breakdown = new HybridScoreCombiner(config).combine(subScores, upstream, evidence);
        MatchResult result = MatchResult.of(breakdown);
        log.debug("Match scored: composite={}, category={}, subScores={}",
                  result.compositeScore(), result.category(), subScores);
        return result;
    }

    private List<float[]> embed(List<String> texts) {
        try {
            return embeddingProvider.embed(texts);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Embedding provider {} failed: {}", embeddingProvider.getModel(), e.getMessage());
            throw new ProviderException("Embedding provider failed: " + e.getMessage(), e);
        }
    }

    private static void requireFinite(List<float[]> vectors) {
        for (int i = 0; i < vectors.size(); i++) {
            float[] v = vectors.get(i);
            if (v == null) {
                throw new ProviderException("Embedding provider returned no vector for text " + i);
            }
            for (int j = 0; j < v.length; j++) {
                if (!Float.isFinite(v[j])) {
                    throw new ProviderException("Embedding provider returned non-finite value "
                        + v[j] + " at text " + i + ", component " + j);
                }
            }
        }
    }
}
