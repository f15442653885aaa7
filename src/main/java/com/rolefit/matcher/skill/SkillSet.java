package com.rolefit.matcher.skill;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical skills found in one document, split by tier.
 * A skill is in at most one of the two sets; required wins when both were seen.
 */
public final class SkillSet {

    private static final SkillSet EMPTY = new SkillSet(Set.of(), Set.of());

    private final Set<String> required;
    private final Set<String> preferred;

    public SkillSet(Set<String> required, Set<String> preferred) {
        if (required == null || preferred == null) {
            throw new IllegalArgumentException("Skill sets cannot be null");
        }
        TreeSet<String> req = new TreeSet<>(required);
        TreeSet<String> pref = new TreeSet<>(preferred);
        pref.removeAll(req);
        this.required = Collections.unmodifiableSet(req);
        this.preferred = Collections.unmodifiableSet(pref);
    }

    public static SkillSet empty() {
        return EMPTY;
    }

    public Set<String> getRequired() {
        return required;
    }

    public Set<String> getPreferred() {
        return preferred;
    }

    /**
     * Every skill in either tier, sorted.
     */
    public Set<String> all() {
        TreeSet<String> all = new TreeSet<>(required);
        all.addAll(preferred);
        return Collections.unmodifiableSet(all);
    }

    public boolean isEmpty() {
        return required.isEmpty() && preferred.isEmpty();
    }

    @Override
    public String toString() {
        return "SkillSet{required=" + required + ", preferred=" + preferred + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SkillSet that = (SkillSet) o;
        return required.equals(that.required) && preferred.equals(that.preferred);
    }

    @Override
    public int hashCode() {
        return 31 * required.hashCode() + preferred.hashCode();
    }
}
