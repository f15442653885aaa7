package com.rolefit.matcher.command;

import com.rolefit.matcher.config.RolefitConfig;
import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.explain.Explanation;
import com.rolefit.matcher.explain.ExplanationProviders;
import com.rolefit.matcher.explain.ExplanationService;
import com.rolefit.matcher.report.ConsoleReporter;
import com.rolefit.matcher.score.HybridMatchingEngine;
import com.rolefit.matcher.score.MatchResult;
import com.rolefit.matcher.skill.SkillVocabulary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

@Command(
    name = "score",
    description = "Score one candidate document against a target role",
    mixinStandardHelpOptions = true
)
public class ScoreCommand extends AbstractMatchCommand {

    @Option(names = {"-c", "--candidate"}, description = "Candidate document (plain text)", required = true)
    private Path candidateFile;

    @Option(names = {"-r", "--role"}, description = "Target role document (plain text)", required = true)
    private Path roleFile;

    @Option(names = {"-e", "--explain"}, description = "Explanation provider: none, template, chat")
    private String explainType;

    @Override
    protected int execute(RolefitConfig config, HybridMatchingEngine engine, SkillVocabulary vocabulary)
            throws IOException {
        if (explainType != null) {
            config.getProviders().getExplanation().setType(explainType);
        }
        ExplanationService explanations = ExplanationProviders.createService(config.getProviders().getExplanation());

        String roleText = roleText(config, readText(roleFile));
        MatchResult result = engine.score(
            Document.candidate(readText(candidateFile)),
            Document.targetRole(roleText),
            config.getScoring(),
            vocabulary);

        String candidateName = displayName(candidateFile);
        String roleName = displayName(roleFile);
        ConsoleReporter reporter = new ConsoleReporter(System.out, quiet);

        switch (outputFormat.toLowerCase(Locale.ROOT)) {
            case "csv" -> reporter.printMatchResultCsv(candidateName, roleName, result);
            case "json" -> reporter.printMatchResultJson(candidateName, roleName, result,
                explanations.explain(result, roleText));
            default -> {
                Optional<Explanation> explanation = quiet ? Optional.empty() : explanations.explain(result, roleText);
                reporter.printMatchResult(candidateName, roleName, result, explanation);
            }
        }
        return EXIT_OK;
    }
}
