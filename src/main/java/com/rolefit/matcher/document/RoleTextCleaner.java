package com.rolefit.matcher.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drops role-description sections that carry no requirements (company blurb, benefits,
 * salary, equal-opportunity statements, application instructions).
 *
 * <p>A short line naming an irrelevant section starts skipping; a short line naming a
 * requirements-type section stops it. When the result is shorter than
 * {@link #MIN_CLEANED_LENGTH} characters the original text is returned unchanged.
 */
public class RoleTextCleaner {

    private static final Logger log = LoggerFactory.getLogger(RoleTextCleaner.class);

    public static final int MIN_CLEANED_LENGTH = 100;

    private static final int MAX_HEADING_WORDS = 8;

    private static final List<String> RELEVANT_SECTIONS = List.of(
        "responsibilities", "requirements", "qualifications", "required", "preferred",
        "skills", "experience", "education", "what you'll do", "what you will do",
        "what you need", "you will", "must have", "should have", "nice to have");

    private static final List<String> IRRELEVANT_SECTIONS = List.of(
        "about us", "company overview", "who we are", "our mission", "our values",
        "benefits", "compensation", "salary", "perks", "what we offer",
        "equal opportunity", "eeo", "diversity", "application process",
        "how to apply", "contact", "location details");

    public String clean(String roleText) {
        if (roleText == null) {
            throw new IllegalArgumentException("Role text cannot be null");
        }

        List<String> kept = new ArrayList<>();
        boolean skipping = false;
        int dropped = 0;
        for (String line : roleText.split("\\R")) {
            String lower = line.strip().toLowerCase(Locale.ROOT);
            if (isHeading(lower)) {
                if (containsAny(lower, IRRELEVANT_SECTIONS)) {
                    skipping = true;
                    dropped++;
                    continue;
                }
                if (containsAny(lower, RELEVANT_SECTIONS)) {
                    skipping = false;
                }
            }
            if (skipping) {
                if (!lower.isEmpty()) {
                    dropped++;
                }
                continue;
            }
            if (!lower.isEmpty()) {
                kept.add(line);
            }
        }

        String cleaned = String.join("\n", kept);
        if (cleaned.length() < MIN_CLEANED_LENGTH) {
            log.debug("Cleaned role text too short ({} chars), keeping original", cleaned.length());
            return roleText;
        }
        log.debug("Role text cleaned: {} lines dropped", dropped);
        return cleaned;
    }

    private static boolean isHeading(String lowerLine) {
        return !lowerLine.isEmpty() && lowerLine.split("\\s+").length <= MAX_HEADING_WORDS;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
