package com.rolefit.matcher.skill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds vocabulary skills in a document and sorts them into required and preferred.
 *
 * <p>Classification follows {@link SectionClassifier}. If classification fails for any
 * reason the extractor falls back to treating every skill found as required.
 */
public class SkillExtractor {

    private static final Logger log = LoggerFactory.getLogger(SkillExtractor.class);

    private final SectionClassifier classifier;

    public SkillExtractor() {
        this(new SectionClassifier());
    }

    public SkillExtractor(SectionClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Extract the skills mentioned in a document.
     *
     * @param text       document text
     * @param vocabulary skills to look for
     * @return the skills found, by tier
     */
    public SkillSet extract(String text, SkillVocabulary vocabulary) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        if (vocabulary == null) {
            throw new IllegalArgumentException("Vocabulary cannot be null");
        }
        if (text.isBlank()) {
            return SkillSet.empty();
        }

        try {
            Set<String> required = new LinkedHashSet<>();
            Set<String> preferred = new LinkedHashSet<>();
            for (ClassifiedLine line : classifier.classify(text)) {
                Set<String> found = vocabulary.findIn(line.text());
                if (line.tier() == SkillTier.PREFERRED) {
                    preferred.addAll(found);
                } else {
                    required.addAll(found);
                }
            }
            SkillSet skills = new SkillSet(required, preferred);
            log.debug("Extracted {} required and {} preferred skills",
                      skills.getRequired().size(), skills.getPreferred().size());
            return skills;
        } catch (RuntimeException e) {
            log.warn("Section classification failed, treating all skills as required: {}", e.getMessage());
            return new SkillSet(vocabulary.findIn(text), Set.of());
        }
    }
}
