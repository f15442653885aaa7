package com.rolefit.matcher.explain;

/**
 * Produces prose for a scored match. Output is opaque to the scoring engine.
 */
public interface ExplanationProvider {

    /**
     * @throws com.rolefit.matcher.semantic.ProviderException when no explanation can be produced
     */
    Explanation explain(ExplanationRequest request);

    String getName();
}
