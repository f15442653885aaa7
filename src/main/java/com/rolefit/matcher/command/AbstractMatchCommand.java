package com.rolefit.matcher.command;

import com.rolefit.matcher.MatchingException;
import com.rolefit.matcher.RolefitCli;
import com.rolefit.matcher.config.ConfigException;
import com.rolefit.matcher.config.RolefitConfig;
import com.rolefit.matcher.config.ScoringConfig;
import com.rolefit.matcher.document.EmptyInputException;
import com.rolefit.matcher.document.RoleTextCleaner;
import com.rolefit.matcher.score.HybridMatchingEngine;
import com.rolefit.matcher.semantic.EmbeddingProviders;
import com.rolefit.matcher.skill.SkillVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Options and error handling shared by the scoring subcommands.
 *
 * <p>Exit codes: 0 on success, 1 on a runtime failure (for example an unreachable embedding
 * endpoint), 2 on invalid configuration or input.
 */
abstract class AbstractMatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractMatchCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID = 2;

    @ParentCommand
    private RolefitCli parent;

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    private String configFile;

    @Option(names = {"--skills"}, description = "Skill vocabulary YAML file (default: bundled vocabulary)")
    private String skillsFile;

    @Option(names = {"--embedding"}, description = "Embedding provider: hashing, openai")
    private String embeddingType;

    @Option(names = {"--boost"}, description = "Semantic boost factor")
    private Double boostFactor;

    @Option(names = {"--window"}, description = "Chunk window size in words")
    private Integer windowWords;

    @Option(names = {"--overlap"}, description = "Chunk overlap in words")
    private Integer overlapWords;

    @Option(names = {"--clean-role"}, description = "Drop company, benefits and application sections from the role text")
    private Boolean cleanRole;

    @Option(names = {"-q", "--quiet"}, description = "Compact output", defaultValue = "false")
    protected boolean quiet;

    @Option(names = {"--output-format"}, description = "Output format: console, csv, json", defaultValue = "console")
    protected String outputFormat;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.applyLogLevel();
        }
        try {
            RolefitConfig config = buildConfig();
            config.getScoring().validate();
            SkillVocabulary vocabulary = loadVocabulary(config);
            HybridMatchingEngine engine = new HybridMatchingEngine(
                EmbeddingProviders.create(config.getProviders().getEmbedding()), vocabulary);
            return execute(config, engine, vocabulary);
        } catch (ConfigException | EmptyInputException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            System.err.println("Error: cannot read input: " + e.getMessage());
            return EXIT_INVALID;
        } catch (MatchingException e) {
            log.debug("Scoring failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    protected abstract int execute(RolefitConfig config, HybridMatchingEngine engine, SkillVocabulary vocabulary)
        throws IOException;

    RolefitConfig buildConfig() throws IOException {
        RolefitConfig config = configFile != null ? RolefitConfig.fromYaml(configFile) : new RolefitConfig();

        // CLI options override config file
        ScoringConfig scoring = config.getScoring();
        if (boostFactor != null) {
            scoring.setSemanticBoostFactor(boostFactor);
        }
        if (windowWords != null) {
            scoring.setChunkWindowWords(windowWords);
        }
        if (overlapWords != null) {
            scoring.setChunkOverlapWords(overlapWords);
        }
        if (embeddingType != null) {
            config.getProviders().getEmbedding().setType(embeddingType);
        }
        if (skillsFile != null) {
            config.setSkillsFile(skillsFile);
        }
        if (cleanRole != null) {
            config.setCleanRoleText(cleanRole);
        }
        return config;
    }

    private static SkillVocabulary loadVocabulary(RolefitConfig config) throws IOException {
        if (config.getSkillsFile() != null) {
            return SkillVocabulary.fromYaml(config.getSkillsFile());
        }
        return SkillVocabulary.loadDefault();
    }

    static String readText(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    static String roleText(RolefitConfig config, String raw) {
        return config.isCleanRoleText() ? new RoleTextCleaner().clean(raw) : raw;
    }

    static String displayName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
