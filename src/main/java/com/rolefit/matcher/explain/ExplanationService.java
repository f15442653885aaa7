package com.rolefit.matcher.explain;

import com.rolefit.matcher.score.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runs the configured explanation provider without letting it affect scoring.
 *
 * <p>A failing primary provider is logged and replaced by the fallback provider when one is
 * set; with no fallback the caller gets an empty result.
 */
public class ExplanationService {

    private static final Logger log = LoggerFactory.getLogger(ExplanationService.class);

    private final ExplanationProvider primary;
    private final ExplanationProvider fallback;

    /**
     * @param primary  provider to try first; null disables explanations
     * @param fallback provider used when the primary fails; may be null
     */
    public ExplanationService(ExplanationProvider primary, ExplanationProvider fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    public Optional<Explanation> explain(MatchResult result, String roleText) {
        if (primary == null || result == null) {
            return Optional.empty();
        }
        ExplanationRequest request = ExplanationRequest.from(result, roleText);

        Optional<Explanation> explanation = tryProvider(primary, request);
        if (explanation.isEmpty() && fallback != null && fallback != primary) {
            explanation = tryProvider(fallback, request);
        }
        return explanation;
    }

    private static Optional<Explanation> tryProvider(ExplanationProvider provider, ExplanationRequest request) {
        try {
            return Optional.ofNullable(provider.explain(request));
        } catch (RuntimeException e) {
            log.warn("Explanation provider '{}' failed, continuing without it: {}", provider.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
