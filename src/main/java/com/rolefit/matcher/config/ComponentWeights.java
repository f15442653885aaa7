package com.rolefit.matcher.config;

/**
 * Weights applied to the four sub-scores in the composite formula.
 * Must sum to 1.0; see {@link ScoringConfig#validate()}.
 */
public class ComponentWeights {

    /** Absolute tolerance when checking that the weights sum to one. */
    public static final double SUM_TOLERANCE = 1e-9;

    private double technicalSkill = 0.40;
    private double semantic = 0.30;
    private double experience = 0.20;
    private double education = 0.10;

    public ComponentWeights() {
    }

    public ComponentWeights(double technicalSkill, double semantic, double experience, double education) {
        this.technicalSkill = technicalSkill;
        this.semantic = semantic;
        this.experience = experience;
        this.education = education;
    }

    public double sum() {
        return technicalSkill + semantic + experience + education;
    }

    void validate() {
        requireUnitInterval("technicalSkill", technicalSkill);
        requireUnitInterval("semantic", semantic);
        requireUnitInterval("experience", experience);
        requireUnitInterval("education", education);

        double sum = sum();
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigException(String.format(
                "Component weights must sum to 1.0, got %.6f (%s)", sum, this));
        }
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigException("Weight '" + name + "' must be between 0.0 and 1.0, got " + value);
        }
    }

    public double getTechnicalSkill() {
        return technicalSkill;
    }

    public void setTechnicalSkill(double technicalSkill) {
        this.technicalSkill = technicalSkill;
    }

    public double getSemantic() {
        return semantic;
    }

    public void setSemantic(double semantic) {
        this.semantic = semantic;
    }

    public double getExperience() {
        return experience;
    }

    public void setExperience(double experience) {
        this.experience = experience;
    }

    public double getEducation() {
        return education;
    }

    public void setEducation(double education) {
        this.education = education;
    }

    @Override
    public String toString() {
        return String.format("%.2f/%.2f/%.2f/%.2f", technicalSkill, semantic, experience, education);
    }
}
