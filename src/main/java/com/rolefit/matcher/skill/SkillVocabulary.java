package com.rolefit.matcher.skill;

import com.rolefit.matcher.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Read-only mapping from canonical skill name to its surface-form aliases.
 *
 * <p>The canonical name always counts as one of its own aliases. Aliases are matched
 * case-insensitively on word boundaries, where a boundary is any position not flanked by
 * a letter or digit, so forms like {@code c++}, {@code node.js} and {@code ci/cd} match
 * as written. Instances are immutable and safe to share across threads.
 */
public final class SkillVocabulary {

    private static final Logger log = LoggerFactory.getLogger(SkillVocabulary.class);

    /** Bundled vocabulary on the classpath. */
    public static final String DEFAULT_RESOURCE = "/skills.yml";

    private final Map<String, Set<String>> aliases;
    private final List<AliasPattern> patterns;

    /**
     * One compiled alias and the canonical skill it resolves to.
     */
    record AliasPattern(String canonical, String alias, Pattern pattern) {}

    private SkillVocabulary(Map<String, Set<String>> aliases) {
        this.aliases = aliases;
        List<AliasPattern> compiled = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : aliases.entrySet()) {
            for (String alias : entry.getValue()) {
                compiled.add(new AliasPattern(entry.getKey(), alias, compile(alias)));
            }
        }
        this.patterns = Collections.unmodifiableList(compiled);
    }

    /**
     * Build a vocabulary from canonical name to alias list.
     *
     * @param source canonical skill to aliases; a null or empty alias list means the name only
     */
    public static SkillVocabulary of(Map<String, ? extends Iterable<String>> source) {
        if (source == null) {
            throw new IllegalArgumentException("Vocabulary source cannot be null");
        }
        Map<String, Set<String>> normalized = new TreeMap<>();
        for (Map.Entry<String, ? extends Iterable<String>> entry : source.entrySet()) {
            String canonical = normalize(entry.getKey());
            if (canonical.isEmpty()) {
                throw new ConfigException("Skill vocabulary contains a blank canonical name");
            }
            Set<String> forms = normalized.computeIfAbsent(canonical, k -> new LinkedHashSet<>());
            forms.add(canonical);
            if (entry.getValue() != null) {
                for (String alias : entry.getValue()) {
                    String form = normalize(alias);
                    if (!form.isEmpty()) {
                        forms.add(form);
                    }
                }
            }
        }

        Map<String, Set<String>> frozen = new TreeMap<>();
        normalized.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        return new SkillVocabulary(Collections.unmodifiableMap(frozen));
    }

    /**
     * Load the vocabulary bundled with the application.
     */
    public static SkillVocabulary loadDefault() {
        try (InputStream input = SkillVocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new ConfigException("Skill vocabulary resource not found: " + DEFAULT_RESOURCE);
            }
            return fromYaml(input);
        } catch (IOException e) {
            throw new ConfigException("Failed to read skill vocabulary resource", e);
        }
    }

    public static SkillVocabulary fromYaml(String filePath) throws IOException {
        try (InputStream input = new FileInputStream(filePath)) {
            return fromYaml(input);
        }
    }

    /**
     * Parse a YAML document with a top-level {@code skills:} map of canonical name to aliases.
     */
    public static SkillVocabulary fromYaml(InputStream input) {
        Object data = new Yaml().load(input);
        Object skills = data instanceof Map<?, ?> root ? root.get("skills") : null;
        if (!(skills instanceof Map<?, ?> skillMap)) {
            throw new ConfigException("Skill vocabulary must contain a 'skills' map");
        }

        Map<String, List<String>> source = new TreeMap<>();
        for (Map.Entry<?, ?> entry : skillMap.entrySet()) {
            List<String> forms = new ArrayList<>();
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                for (Object alias : list) {
                    forms.add(String.valueOf(alias));
                }
            } else if (value != null) {
                forms.add(String.valueOf(value));
            }
            source.put(String.valueOf(entry.getKey()), forms);
        }

        SkillVocabulary vocabulary = of(source);
        log.debug("Loaded skill vocabulary: {} skills, {} aliases", vocabulary.size(), vocabulary.patterns.size());
        return vocabulary;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static Pattern compile(String alias) {
        String body = Pattern.quote(alias).replace(" ", "\\E\\s+\\Q");
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + body + "(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Canonical skills whose aliases appear in the text, in canonical order.
     */
    public Set<String> findIn(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        Set<String> found = new LinkedHashSet<>();
        if (text.isBlank()) {
            return found;
        }
        for (AliasPattern p : patterns) {
            if (!found.contains(p.canonical()) && p.pattern().matcher(text).find()) {
                found.add(p.canonical());
            }
        }
        return found;
    }

    public boolean contains(String canonical) {
        return aliases.containsKey(normalize(canonical));
    }

    public Set<String> getCanonicalSkills() {
        return aliases.keySet();
    }

    public Set<String> getAliases(String canonical) {
        Set<String> forms = aliases.get(normalize(canonical));
        return forms != null ? forms : Collections.emptySet();
    }

    public int size() {
        return aliases.size();
    }
}
