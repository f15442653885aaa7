package com.rolefit.matcher.config;

import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Calibration constants for the hybrid matching engine.
 *
 * <p>Every tunable number the engine uses lives here rather than in the algorithm code.
 * Instances are mutable while being assembled (YAML file, then CLI overrides) and are
 * checked by {@link #validate()} before any scoring happens.
 */
public class ScoringConfig {

    // Chunking
    private int chunkWindowWords = 200;
    private int chunkOverlapWords = 75;

    // Semantic signal
    private double semanticBoostFactor = 1.8;
    private int topMatchCount = 5;

    // Composite
    private ComponentWeights componentWeights = new ComponentWeights();

    // Keyword signal
    private int missingSkillPenaltyThreshold = 3;
    private double missingSkillPenaltyAmount = 0.15;

    // Cross-domain adjustment
    private double crossDomainSemanticThreshold = 0.4;
    private double crossDomainKeywordThreshold = 0.5;
    private double crossDomainBonus = 0.05;

    // Auxiliary matchers
    private double experienceMaxShortfallYears = 5.0;
    private double educationPartialCredit = 0.5;

    public ScoringConfig() {
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig();
    }

    /**
     * Load from a YAML file. Values are read from the {@code scoring:} block;
     * anything missing keeps its default.
     */
    public static ScoringConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Map<String, Object> data = YamlValues.root(yaml.load(input), filePath);
            return fromMap(data);
        }
    }

    static ScoringConfig fromMap(Map<String, Object> data) {
        ScoringConfig config = new ScoringConfig();
        if (data == null || !data.containsKey("scoring")) {
            return config;
        }

        Map<String, Object> scoring = YamlValues.section(data, "scoring", "");
        if (scoring.containsKey("chunkWindowWords")) {
            config.chunkWindowWords = YamlValues.intValue(scoring, "chunkWindowWords", "scoring");
        }
        if (scoring.containsKey("chunkOverlapWords")) {
            config.chunkOverlapWords = YamlValues.intValue(scoring, "chunkOverlapWords", "scoring");
        }
        if (scoring.containsKey("semanticBoostFactor")) {
            config.semanticBoostFactor = YamlValues.doubleValue(scoring, "semanticBoostFactor", "scoring");
        }
        if (scoring.containsKey("topMatchCount")) {
            config.topMatchCount = YamlValues.intValue(scoring, "topMatchCount", "scoring");
        }
        if (scoring.containsKey("componentWeights")) {
            Map<String, Object> w = YamlValues.section(scoring, "componentWeights", "scoring");
            ComponentWeights weights = new ComponentWeights();
            if (w.containsKey("technicalSkill")) {
                weights.setTechnicalSkill(YamlValues.doubleValue(w, "technicalSkill", "scoring.componentWeights"));
            }
            if (w.containsKey("semantic")) {
                weights.setSemantic(YamlValues.doubleValue(w, "semantic", "scoring.componentWeights"));
            }
            if (w.containsKey("experience")) {
                weights.setExperience(YamlValues.doubleValue(w, "experience", "scoring.componentWeights"));
            }
            if (w.containsKey("education")) {
                weights.setEducation(YamlValues.doubleValue(w, "education", "scoring.componentWeights"));
            }
            config.componentWeights = weights;
        }
        if (scoring.containsKey("missingSkillPenaltyThreshold")) {
            config.missingSkillPenaltyThreshold = YamlValues.intValue(scoring, "missingSkillPenaltyThreshold", "scoring");
        }
        if (scoring.containsKey("missingSkillPenaltyAmount")) {
            config.missingSkillPenaltyAmount = YamlValues.doubleValue(scoring, "missingSkillPenaltyAmount", "scoring");
        }
        if (scoring.containsKey("crossDomainSemanticThreshold")) {
            config.crossDomainSemanticThreshold = YamlValues.doubleValue(scoring, "crossDomainSemanticThreshold", "scoring");
        }
        if (scoring.containsKey("crossDomainKeywordThreshold")) {
            config.crossDomainKeywordThreshold = YamlValues.doubleValue(scoring, "crossDomainKeywordThreshold", "scoring");
        }
        if (scoring.containsKey("crossDomainBonus")) {
            config.crossDomainBonus = YamlValues.doubleValue(scoring, "crossDomainBonus", "scoring");
        }
        if (scoring.containsKey("experienceMaxShortfallYears")) {
            config.experienceMaxShortfallYears = YamlValues.doubleValue(scoring, "experienceMaxShortfallYears", "scoring");
        }
        if (scoring.containsKey("educationPartialCredit")) {
            config.educationPartialCredit = YamlValues.doubleValue(scoring, "educationPartialCredit", "scoring");
        }
        return config;
    }

    /**
     * Check every structural invariant.
     *
     * @throws ConfigException on the first violated invariant
     */
    public ScoringConfig validate() {
        if (componentWeights == null) {
            throw new ConfigException("Component weights cannot be null");
        }
        componentWeights.validate();

        if (chunkWindowWords <= 0) {
            throw new ConfigException("chunkWindowWords must be positive, got " + chunkWindowWords);
        }
        if (chunkOverlapWords < 0 || chunkOverlapWords >= chunkWindowWords) {
            throw new ConfigException("chunkOverlapWords must be in [0, " + chunkWindowWords
                + "), got " + chunkOverlapWords);
        }
        if (!(semanticBoostFactor > 0.0) || Double.isInfinite(semanticBoostFactor)) {
            throw new ConfigException("semanticBoostFactor must be a positive number, got " + semanticBoostFactor);
        }
        if (topMatchCount < 1) {
            throw new ConfigException("topMatchCount must be at least 1, got " + topMatchCount);
        }
        if (missingSkillPenaltyThreshold < 1) {
            throw new ConfigException("missingSkillPenaltyThreshold must be at least 1, got "
                + missingSkillPenaltyThreshold);
        }
        requireUnitInterval("missingSkillPenaltyAmount", missingSkillPenaltyAmount);
        requireNonNegative("crossDomainSemanticThreshold", crossDomainSemanticThreshold);
        requireNonNegative("crossDomainKeywordThreshold", crossDomainKeywordThreshold);
        requireUnitInterval("crossDomainBonus", crossDomainBonus);
        if (!(experienceMaxShortfallYears > 0.0)) {
            throw new ConfigException("experienceMaxShortfallYears must be positive, got "
                + experienceMaxShortfallYears);
        }
        requireUnitInterval("educationPartialCredit", educationPartialCredit);
        return this;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
            throw new ConfigException(name + " must be a non-negative number, got " + value);
        }
    }

    // Getters and setters
    public int getChunkWindowWords() {
        return chunkWindowWords;
    }

    public void setChunkWindowWords(int chunkWindowWords) {
        this.chunkWindowWords = chunkWindowWords;
    }

    public int getChunkOverlapWords() {
        return chunkOverlapWords;
    }

    public void setChunkOverlapWords(int chunkOverlapWords) {
        this.chunkOverlapWords = chunkOverlapWords;
    }

    public double getSemanticBoostFactor() {
        return semanticBoostFactor;
    }

    public void setSemanticBoostFactor(double semanticBoostFactor) {
        this.semanticBoostFactor = semanticBoostFactor;
    }

    public int getTopMatchCount() {
        return topMatchCount;
    }

    public void setTopMatchCount(int topMatchCount) {
        this.topMatchCount = topMatchCount;
    }

    public ComponentWeights getComponentWeights() {
        return componentWeights;
    }

    public void setComponentWeights(ComponentWeights componentWeights) {
        this.componentWeights = componentWeights;
    }

    public int getMissingSkillPenaltyThreshold() {
        return missingSkillPenaltyThreshold;
    }

    public void setMissingSkillPenaltyThreshold(int missingSkillPenaltyThreshold) {
        this.missingSkillPenaltyThreshold = missingSkillPenaltyThreshold;
    }

    public double getMissingSkillPenaltyAmount() {
        return missingSkillPenaltyAmount;
    }

    public void setMissingSkillPenaltyAmount(double missingSkillPenaltyAmount) {
        this.missingSkillPenaltyAmount = missingSkillPenaltyAmount;
    }

    public double getCrossDomainSemanticThreshold() {
        return crossDomainSemanticThreshold;
    }

    public void setCrossDomainSemanticThreshold(double crossDomainSemanticThreshold) {
        this.crossDomainSemanticThreshold = crossDomainSemanticThreshold;
    }

    public double getCrossDomainKeywordThreshold() {
        return crossDomainKeywordThreshold;
    }

    public void setCrossDomainKeywordThreshold(double crossDomainKeywordThreshold) {
        this.crossDomainKeywordThreshold = crossDomainKeywordThreshold;
    }

    public double getCrossDomainBonus() {
        return crossDomainBonus;
    }

    public void setCrossDomainBonus(double crossDomainBonus) {
        this.crossDomainBonus = crossDomainBonus;
    }

    public double getExperienceMaxShortfallYears() {
        return experienceMaxShortfallYears;
    }

    public void setExperienceMaxShortfallYears(double experienceMaxShortfallYears) {
        this.experienceMaxShortfallYears = experienceMaxShortfallYears;
    }

    public double getEducationPartialCredit() {
        return educationPartialCredit;
    }

    public void setEducationPartialCredit(double educationPartialCredit) {
        this.educationPartialCredit = educationPartialCredit;
    }
}
