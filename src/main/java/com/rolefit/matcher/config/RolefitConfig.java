package com.rolefit.matcher.config;

import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Top-level configuration file: scoring calibration, providers and vocabulary location.
 *
 * <pre>
 * scoring:
 *   semanticBoostFactor: 1.8
 *   componentWeights: { technicalSkill: 0.4, semantic: 0.3, experience: 0.2, education: 0.1 }
 * providers:
 *   embedding: { type: hashing, dimension: 384 }
 *   explanation: { type: template }
 * skills:
 *   file: /path/to/skills.yml
 * cleanRoleText: true
 * </pre>
 */
public class RolefitConfig {

    private ScoringConfig scoring = new ScoringConfig();
    private ProviderConfig providers = new ProviderConfig();
    private String skillsFile;
    private boolean cleanRoleText = false;

    public static RolefitConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Map<String, Object> data = YamlValues.root(yaml.load(input), filePath);
            return fromMap(data);
        }
    }

    static RolefitConfig fromMap(Map<String, Object> data) {
        RolefitConfig config = new RolefitConfig();
        config.scoring = ScoringConfig.fromMap(data);
        config.providers = ProviderConfig.fromMap(data);

        if (data != null && data.containsKey("skills")) {
            Map<String, Object> skills = YamlValues.section(data, "skills", "");
            if (skills.containsKey("file")) {
                config.skillsFile = YamlValues.string(skills, "file", "skills");
            }
        }
        if (data != null && data.containsKey("cleanRoleText")) {
            config.cleanRoleText = YamlValues.bool(data, "cleanRoleText", "");
        }
        return config;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring;
    }

    public ProviderConfig getProviders() {
        return providers;
    }

    public void setProviders(ProviderConfig providers) {
        this.providers = providers;
    }

    public String getSkillsFile() {
        return skillsFile;
    }

    public void setSkillsFile(String skillsFile) {
        this.skillsFile = skillsFile;
    }

    public boolean isCleanRoleText() {
        return cleanRoleText;
    }

    public void setCleanRoleText(boolean cleanRoleText) {
        this.cleanRoleText = cleanRoleText;
    }
}
