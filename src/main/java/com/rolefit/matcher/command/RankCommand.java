package com.rolefit.matcher.command;

import com.rolefit.matcher.config.RolefitConfig;
import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.rank.CandidateEntry;
import com.rolefit.matcher.rank.CandidateRanker;
import com.rolefit.matcher.rank.Ranking;
import com.rolefit.matcher.report.ConsoleReporter;
import com.rolefit.matcher.score.HybridMatchingEngine;
import com.rolefit.matcher.skill.SkillVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@Command(
    name = "rank",
    description = "Rank candidate documents against a target role",
    mixinStandardHelpOptions = true
)
public class RankCommand extends AbstractMatchCommand {

    private static final Logger log = LoggerFactory.getLogger(RankCommand.class);

    @Option(names = {"-r", "--role"}, description = "Target role document (plain text)", required = true)
    private Path roleFile;

    @Option(names = {"-n", "--top"}, description = "Number of candidates to report", defaultValue = "10")
    private int topN;

    @Parameters(arity = "1..*", paramLabel = "CANDIDATE",
        description = "Candidate files, or directories of .txt/.md files")
    private List<Path> candidatePaths;

    @Override
    protected int execute(RolefitConfig config, HybridMatchingEngine engine, SkillVocabulary vocabulary)
            throws IOException {
        List<CandidateEntry> candidates = new ArrayList<>();
        for (Path file : expand(candidatePaths)) {
            String text = readText(file);
            if (text.isBlank()) {
                log.warn("Skipping empty candidate file {}", file);
                continue;
            }
            candidates.add(CandidateEntry.of(displayName(file), text));
        }

        Ranking ranking = new CandidateRanker(engine).rank(
            candidates,
            Document.targetRole(roleText(config, readText(roleFile))),
            config.getScoring(),
            vocabulary,
            topN);

        String roleName = displayName(roleFile);
        ConsoleReporter reporter = new ConsoleReporter(System.out, quiet);
        switch (outputFormat.toLowerCase(Locale.ROOT)) {
            case "csv" -> reporter.printRankingCsv(roleName, ranking);
            case "json" -> reporter.printRankingJson(roleName, ranking);
            default -> reporter.printRanking(roleName, ranking);
        }
        return EXIT_OK;
    }

    /**
     * Directories contribute their .txt and .md files in name order; files are kept as given.
     */
    static List<Path> expand(List<Path> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> listing = Files.list(path)) {
                    listing.filter(Files::isRegularFile)
                        .filter(p -> {
                            String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                            return name.endsWith(".txt") || name.endsWith(".md");
                        })
                        .sorted()
                        .forEach(files::add);
                }
            } else {
                files.add(path);
            }
        }
        return files;
    }
}
