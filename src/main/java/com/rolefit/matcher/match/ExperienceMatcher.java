package com.rolefit.matcher.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares the years of experience a role asks for with what the candidate shows.
 *
 * <p>Role requirement: the largest "N years ... experience" figure in the role text, or,
 * when there is none, the years implied by a seniority word in the role's first line.
 * Candidate experience: the largest "N years ... experience" figure in the candidate text,
 * or, when there is none, the total span of employment date ranges with overlaps merged.
 *
 * <p>Score is 1.0 when the requirement is met, then falls linearly to 0.0 at a shortfall of
 * {@code maxShortfallYears}. Missing information on either side gives the neutral 1.0.
 */
public class ExperienceMatcher implements AuxiliaryMatcher {

    private static final Logger log = LoggerFactory.getLogger(ExperienceMatcher.class);

    private static final Pattern YEARS_OF_EXPERIENCE = Pattern.compile(
        "(\\d{1,2}(?:\\.\\d)?)\\s*\\+?\\s*(?:(?:-|–|to)\\s*\\d{1,2}\\s*\\+?\\s*)?(?:years?|yrs?)\\b"
            + "[^.\\n]{0,40}?\\bexperience",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern DATE_RANGE = Pattern.compile(
        "\\b((?:19|20)\\d{2})\\s*(?:-|–|—|to)\\s*(?:[A-Za-z]{3,9}\\.?\\s+)?((?:19|20)\\d{2}|present|current|now|today)\\b",
        Pattern.CASE_INSENSITIVE);

    private final double maxShortfallYears;
    private final Year referenceYear;

    /**
     * @param maxShortfallYears shortfall at which the score reaches zero
     * @param referenceYear     year substituted for "present" in date ranges
     */
    public ExperienceMatcher(double maxShortfallYears, Year referenceYear) {
        if (!(maxShortfallYears > 0.0)) {
            throw new IllegalArgumentException("Max shortfall must be positive, got " + maxShortfallYears);
        }
        if (referenceYear == null) {
            throw new IllegalArgumentException("Reference year cannot be null");
        }
        this.maxShortfallYears = maxShortfallYears;
        this.referenceYear = referenceYear;
    }

    @Override
    public double score(String candidateText, String roleText) {
        if (candidateText == null || roleText == null) {
            return NEUTRAL;
        }

        OptionalDouble required = requiredYears(roleText);
        OptionalDouble actual = candidateYears(candidateText);
        if (required.isEmpty() || actual.isEmpty()) {
            log.debug("Experience signal unavailable (required={}, candidate={}), using neutral score",
                      required, actual);
            return NEUTRAL;
        }

        double shortfall = required.getAsDouble() - actual.getAsDouble();
        double score = shortfall <= 0.0 ? 1.0 : Math.max(0.0, 1.0 - shortfall / maxShortfallYears);
        log.debug("Experience: required={} years, candidate={} years, score={}",
                  required.getAsDouble(), actual.getAsDouble(), score);
        return score;
    }

    /**
     * Years the role asks for, if stated or implied.
     */
    public OptionalDouble requiredYears(String roleText) {
        OptionalDouble stated = largestStatedYears(roleText);
        if (stated.isPresent()) {
            return stated;
        }

        String title = roleText.strip().lines().findFirst().orElse("");
        for (int i = SeniorityLevel.values().length - 1; i >= 0; i--) {
            SeniorityLevel level = SeniorityLevel.values()[i];
            if (level.foundIn(title)) {
                return OptionalDouble.of(level.getImpliedYears());
            }
        }
        return OptionalDouble.empty();
    }

    /**
     * Years of experience the candidate appears to have.
     */
    public OptionalDouble candidateYears(String candidateText) {
        OptionalDouble stated = largestStatedYears(candidateText);
        if (stated.isPresent()) {
            return stated;
        }
        int spanned = employmentYears(candidateText);
        return spanned > 0 ? OptionalDouble.of(spanned) : OptionalDouble.empty();
    }

    private OptionalDouble largestStatedYears(String text) {
        OptionalDouble best = OptionalDouble.empty();
        Matcher m = YEARS_OF_EXPERIENCE.matcher(text);
        while (m.find()) {
            double years = Double.parseDouble(m.group(1));
            if (best.isEmpty() || years > best.getAsDouble()) {
                best = OptionalDouble.of(years);
            }
        }
        return best;
    }

    private int employmentYears(String text) {
        List<int[]> ranges = new ArrayList<>();
        Matcher m = DATE_RANGE.matcher(text);
        while (m.find()) {
            int start = Integer.parseInt(m.group(1));
            String endToken = m.group(2).toLowerCase(Locale.ROOT);
            int end = Character.isDigit(endToken.charAt(0)) ? Integer.parseInt(endToken) : referenceYear.getValue();
            if (end >= start && end <= referenceYear.getValue() + 1) {
                ranges.add(new int[] {start, end});
            }
        }
        if (ranges.isEmpty()) {
            return 0;
        }

        ranges.sort(Comparator.comparingInt((int[] r) -> r[0]).thenComparingInt(r -> r[1]));
        int total = 0;
        int curStart = ranges.get(0)[0];
        int curEnd = ranges.get(0)[1];
        for (int[] r : ranges.subList(1, ranges.size())) {
            if (r[0] <= curEnd) {
                curEnd = Math.max(curEnd, r[1]);
            } else {
                total += curEnd - curStart;
                curStart = r[0];
                curEnd = r[1];
            }
        }
        total += curEnd - curStart;
        return total;
    }
}
