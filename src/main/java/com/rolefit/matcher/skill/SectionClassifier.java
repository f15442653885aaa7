package com.rolefit.matcher.skill;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks a role document line by line and tracks whether the text sits under a
 * "required" heading, a "preferred" heading, or neither.
 *
 * <p>Transitions:
 * <ul>
 *   <li>A heading naming only the preferred tier moves to {@link SectionState#UNDER_PREFERRED_HEADING}.</li>
 *   <li>A heading naming only the required tier moves to {@link SectionState#UNDER_REQUIRED_HEADING}.</li>
 *   <li>Any other heading, including one naming both tiers, moves to {@link SectionState#UNCLASSIFIED}.</li>
 *   <li>An inline label such as {@code Nice to have: Docker, Kubernetes} changes the state
 *       like a heading and applies to its own line.</li>
 *   <li>A content line carrying exactly one tier marker ("... is a plus", "... required")
 *       overrides the section tier for that line only.</li>
 * </ul>
 */
public class SectionClassifier {

    private static final int MAX_HEADING_WORDS = 6;
    private static final int MAX_LABEL_LENGTH = 50;

    private static final Pattern PREFERRED_MARKER = Pattern.compile(
        "\\b(preferred|nice[ -]to[ -]haves?|good[ -]to[ -]haves?|bonus|desired|desirable|a plus|pluses|optional)\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern REQUIRED_MARKER = Pattern.compile(
        "\\b(required|requirements|must[ -]haves?|must have|mandatory|essential"
            + "|minimum qualifications|basic qualifications|what you(?:'|’)?ll need|what you need)\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern HEADING_LINE = Pattern.compile(
        "^(?:(?:minimum|basic|required|preferred|desired|additional|bonus|key|technical|core)\\s+)*"
            + "(?:skills|qualifications|requirements|experience|nice[ -]to[ -]haves?|must[ -]haves?"
            + "|good[ -]to[ -]haves?|preferred|required|bonus points?|pluses)(?:\\s*\\(.*\\))?$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern BULLET = Pattern.compile("^(?:[-•·▪◦]|\\*(?!\\*)|\\d+[.)])\\s+");

    private static final Pattern INLINE_LABEL = Pattern.compile("^([^:]{1," + MAX_LABEL_LENGTH + "}):\\s*\\S");

    private static final Set<String> KNOWN_SECTIONS = Set.of(
        "responsibilities", "key responsibilities", "about us", "about the role", "about the company",
        "about you", "benefits", "perks", "what we offer", "what you'll do", "what you will do",
        "who we are", "overview", "job description", "role description", "compensation",
        "how to apply", "education", "our mission", "our values", "location");

    /**
     * Classify every line of a role document.
     *
     * @param text the role document text
     * @return one entry per line, in order
     */
    public List<ClassifiedLine> classify(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }

        List<ClassifiedLine> lines = new ArrayList<>();
        SectionState state = SectionState.UNCLASSIFIED;

        for (String line : text.split("\\R", -1)) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                lines.add(new ClassifiedLine(line, state, state.tier(), false));
                continue;
            }

            String heading = headingLabel(stripped);
            if (heading != null) {
                state = stateFor(heading);
                lines.add(new ClassifiedLine(line, state, state.tier(), true));
                continue;
            }

            String label = inlineLabel(stripped);
            if (label != null && hasMarker(label)) {
                state = stateFor(label);
                lines.add(new ClassifiedLine(line, state, state.tier(), false));
                continue;
            }

            lines.add(new ClassifiedLine(line, state, lineTier(stripped, state), false));
        }
        return lines;
    }

    /**
     * Section state selected by a heading label.
     */
    SectionState stateFor(String label) {
        boolean preferred = PREFERRED_MARKER.matcher(label).find();
        boolean required = REQUIRED_MARKER.matcher(label).find();
        if (preferred && !required) {
            return SectionState.UNDER_PREFERRED_HEADING;
        }
        if (required && !preferred) {
            return SectionState.UNDER_REQUIRED_HEADING;
        }
        return SectionState.UNCLASSIFIED;
    }

    private SkillTier lineTier(String line, SectionState state) {
        boolean preferred = PREFERRED_MARKER.matcher(line).find();
        boolean required = REQUIRED_MARKER.matcher(line).find();
        if (preferred && !required) {
            return SkillTier.PREFERRED;
        }
        if (required && !preferred) {
            return SkillTier.REQUIRED;
        }
        return state.tier();
    }

    private boolean hasMarker(String label) {
        return PREFERRED_MARKER.matcher(label).find() || REQUIRED_MARKER.matcher(label).find();
    }

    /**
     * Returns the heading label when the line is a heading, otherwise null.
     */
    private String headingLabel(String line) {
        if (BULLET.matcher(line).find()) {
            return null;
        }

        boolean markdown = line.startsWith("#");
        String t = line.replaceAll("^#+", "").strip();
        t = t.replaceAll("^[*_]+|[*_]+$", "").strip();
        if (t.isEmpty()) {
            return null;
        }

        if (t.endsWith(":")) {
            String label = t.substring(0, t.length() - 1).replaceAll("[*_]+$", "").strip();
            return wordCount(label) <= MAX_HEADING_WORDS ? label : null;
        }
        if (markdown) {
            return t;
        }

        if (wordCount(t) <= MAX_HEADING_WORDS) {
            String bare = t.replaceAll("[.!]+$", "").toLowerCase(Locale.ROOT);
            if (KNOWN_SECTIONS.contains(bare) || HEADING_LINE.matcher(bare).matches()) {
                return t;
            }
        }
        return null;
    }

    /**
     * Returns the label of a "label: content" line, otherwise null.
     */
    private String inlineLabel(String line) {
        String t = BULLET.matcher(line).replaceFirst("");
        Matcher m = INLINE_LABEL.matcher(t);
        if (!m.find()) {
            return null;
        }
        String label = m.group(1).replaceAll("[*_]", "").strip();
        return wordCount(label) <= MAX_HEADING_WORDS ? label : null;
    }

    private static int wordCount(String s) {
        String t = s.strip();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }
}
